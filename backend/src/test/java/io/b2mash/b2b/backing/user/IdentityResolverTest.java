package io.b2mash.b2b.backing.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.backing.collective.Collective;
import io.b2mash.b2b.backing.collective.CollectiveKind;
import io.b2mash.b2b.backing.collective.CollectiveRepository;
import io.b2mash.b2b.backing.exception.ValidationFailedException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

  @Mock private UserRepository userRepository;
  @Mock private CollectiveRepository collectiveRepository;
  @Mock private PlatformTransactionManager transactionManager;

  private IdentityResolver identityResolver;

  @BeforeEach
  void setUp() {
    identityResolver =
        new IdentityResolver(userRepository, collectiveRepository, transactionManager);
  }

  @Test
  void existing_user_is_returned_by_normalized_email() {
    var user = new User("ada@example.com", "Ada", UUID.randomUUID());
    when(userRepository.findByEmail("ada@example.com")).thenReturn(Optional.of(user));

    assertThat(identityResolver.findOrCreateByEmail("  Ada@Example.com ", null)).isSameAs(user);
    verify(collectiveRepository, never()).save(any());
  }

  @Test
  void new_user_gets_personal_collective() {
    when(userRepository.findByEmail("grace@example.com")).thenReturn(Optional.empty());
    when(collectiveRepository.existsBySlug("grace-hopper")).thenReturn(false);
    when(collectiveRepository.save(any(Collective.class)))
        .thenAnswer(
            inv -> {
              Collective saved = inv.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
              return saved;
            });
    when(userRepository.save(any(User.class)))
        .thenAnswer(
            inv -> {
              User saved = inv.getArgument(0);
              ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
              return saved;
            });

    var user = identityResolver.findOrCreateByEmail("grace@example.com", "Grace Hopper");

    assertThat(user.getEmail()).isEqualTo("grace@example.com");
    assertThat(user.getName()).isEqualTo("Grace Hopper");
    assertThat(user.getCollectiveId()).isNotNull();
  }

  @Test
  void concurrent_creation_re_reads_the_winner() {
    var winner = new User("grace@example.com", "Grace", UUID.randomUUID());
    when(userRepository.findByEmail("grace@example.com"))
        .thenReturn(Optional.empty())
        .thenReturn(Optional.of(winner));
    when(collectiveRepository.existsBySlug("grace")).thenReturn(false);
    when(collectiveRepository.save(any(Collective.class)))
        .thenThrow(new DataIntegrityViolationException("duplicate key"));

    assertThat(identityResolver.findOrCreateByEmail("grace@example.com", "Grace"))
        .isSameAs(winner);
  }

  @Test
  void invalid_email_is_rejected() {
    assertThatThrownBy(() -> identityResolver.findOrCreateByEmail("not-an-email", "X"))
        .isInstanceOf(ValidationFailedException.class)
        .hasMessage("A valid email is required");
  }

  @Test
  void uniqueSlug_appends_suffix_when_taken() {
    var suffixed = "acme-" + SlugGenerator.suffix("seed");
    when(collectiveRepository.existsBySlug("acme")).thenReturn(true);
    when(collectiveRepository.existsBySlug(suffixed)).thenReturn(false);

    assertThat(identityResolver.uniqueSlug("acme", "seed")).isEqualTo(suffixed);
  }

  @Test
  void uniqueSlug_keeps_free_base() {
    when(collectiveRepository.existsBySlug("acme")).thenReturn(false);

    assertThat(identityResolver.uniqueSlug("acme", "seed")).isEqualTo("acme");
    assertThat(new Collective("Acme", "Acme", CollectiveKind.ORGANIZATION).getSlug())
        .isEqualTo("acme");
  }
}
