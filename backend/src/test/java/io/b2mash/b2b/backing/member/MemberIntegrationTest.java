package io.b2mash.b2b.backing.member;

import static io.b2mash.b2b.backing.BackingFixtures.jwtFor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.b2b.backing.BackingFixtures;
import io.b2mash.b2b.backing.collective.CollectiveRepository;
import io.b2mash.b2b.backing.collective.TierRepository;
import io.b2mash.b2b.backing.user.UserRepository;
import java.util.EnumSet;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class MemberIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private CollectiveRepository collectiveRepository;
  @Autowired private UserRepository userRepository;
  @Autowired private TierRepository tierRepository;
  @Autowired private MemberRepository memberRepository;

  private BackingFixtures fixtures;

  @BeforeAll
  void setUpFixtures() {
    fixtures =
        new BackingFixtures(collectiveRepository, userRepository, tierRepository, memberRepository);
  }

  // --- Creating members ---

  @Test
  void adminCreatesBackerForNewEmail() throws Exception {
    var collective = fixtures.collective("Admin managed");
    var admin = fixtures.user("Managing Admin");
    fixtures.member(collective, admin, MemberRole.ADMIN);
    var email = BackingFixtures.unique("newcomer") + "@example.com";

    mockMvc
        .perform(
            post("/api/collectives/{ref}/members", collective.getSlug())
                .with(jwtFor(admin))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "%s", "name": "Grace Hopper", "role": "BACKER"}
                    """
                        .formatted(email)))
        .andExpect(status().isCreated())
        .andExpect(header().exists("Location"))
        .andExpect(jsonPath("$.role").value("BACKER"))
        .andExpect(jsonPath("$.collectiveSlug").value(collective.getSlug()))
        .andExpect(jsonPath("$.name").value("Grace Hopper"))
        .andExpect(jsonPath("$.email").value(email));

    var created = userRepository.findByEmail(email).orElseThrow();
    assertThat(
            memberRepository.existsByCollectiveIdAndMemberCollectiveIdAndRoleIn(
                collective.getId(), created.getCollectiveId(), EnumSet.of(MemberRole.BACKER)))
        .isTrue();
  }

  @Test
  void anyoneMayRegisterAsFollower() throws Exception {
    var collective = fixtures.collective("Open doors");
    var fan = fixtures.user("Curious Fan");

    mockMvc
        .perform(
            post("/api/collectives/{ref}/members", collective.getId())
                .with(jwtFor(fan))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "%s", "role": "FOLLOWER"}
                    """
                        .formatted(fan.getEmail())))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.role").value("FOLLOWER"))
        .andExpect(jsonPath("$.userId").value(fan.getId().toString()))
        .andExpect(jsonPath("$.email").value(fan.getEmail()));
  }

  @Test
  void nonAdminCannotAddBacker() throws Exception {
    var collective = fixtures.collective("Guarded");
    var stranger = fixtures.user("Stranger");

    mockMvc
        .perform(
            post("/api/collectives/{ref}/members", collective.getSlug())
                .with(jwtFor(stranger))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "someone@example.com", "role": "BACKER"}
                    """))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.errors[0].kind").value("Unauthorized"));
  }

  @Test
  void rejectsMissingRole() throws Exception {
    var collective = fixtures.collective("Strict members");
    var admin = fixtures.user("Strict Member Admin");
    fixtures.member(collective, admin, MemberRole.ADMIN);

    mockMvc
        .perform(
            post("/api/collectives/{ref}/members", collective.getSlug())
                .with(jwtFor(admin))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "norole@example.com"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errors[0].kind").value("ValidationFailed"))
        .andExpect(jsonPath("$.errors[*].message", hasItem("role: role is required")));
  }

  @Test
  void returnsNotFoundForUnknownCollective() throws Exception {
    var user = fixtures.user("Wanderer");

    mockMvc
        .perform(
            post("/api/collectives/{ref}/members", "no-such-collective")
                .with(jwtFor(user))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "%s", "role": "FOLLOWER"}
                    """
                        .formatted(user.getEmail())))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.errors[0].kind").value("NotFound"));
  }

  // --- Removing members ---

  @Test
  void memberRemovesOwnMembershipOnce() throws Exception {
    var collective = fixtures.collective("Leaving soon");
    var follower = fixtures.user("Departing Follower");
    fixtures.member(collective, follower, MemberRole.FOLLOWER);

    mockMvc
        .perform(
            delete("/api/collectives/{id}/members", collective.getId())
                .param("userId", follower.getId().toString())
                .param("role", "FOLLOWER")
                .with(jwtFor(follower)))
        .andExpect(status().isNoContent());

    assertThat(memberRepository.countByCollectiveIdAndRole(collective.getId(), MemberRole.FOLLOWER))
        .isZero();

    mockMvc
        .perform(
            delete("/api/collectives/{id}/members", collective.getId())
                .param("userId", follower.getId().toString())
                .param("role", "FOLLOWER")
                .with(jwtFor(follower)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.errors[0].message").value("Member not found"));
  }

  @Test
  void adminRemovesBacker() throws Exception {
    var collective = fixtures.collective("Pruned");
    var admin = fixtures.user("Pruning Admin");
    var backer = fixtures.user("Lapsed Backer");
    fixtures.member(collective, admin, MemberRole.ADMIN);
    fixtures.member(collective, backer, MemberRole.BACKER);

    mockMvc
        .perform(
            delete("/api/collectives/{id}/members", collective.getId())
                .param("userId", backer.getId().toString())
                .param("role", "BACKER")
                .with(jwtFor(admin)))
        .andExpect(status().isNoContent());
  }

  @Test
  void strangerCannotRemoveSomeoneElse() throws Exception {
    var collective = fixtures.collective("Protected");
    var backer = fixtures.user("Protected Backer");
    var stranger = fixtures.user("Meddler");
    fixtures.member(collective, backer, MemberRole.BACKER);

    mockMvc
        .perform(
            delete("/api/collectives/{id}/members", collective.getId())
                .param("userId", backer.getId().toString())
                .param("role", "BACKER")
                .with(jwtFor(stranger)))
        .andExpect(status().isForbidden());

    assertThat(memberRepository.countByCollectiveIdAndRole(collective.getId(), MemberRole.BACKER))
        .isEqualTo(1);
  }

  @Test
  void requiresAuthentication() throws Exception {
    var collective = fixtures.collective("Members only");

    mockMvc
        .perform(
            post("/api/collectives/{ref}/members", collective.getSlug())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"email": "anon@example.com", "role": "FOLLOWER"}
                    """))
        .andExpect(status().isUnauthorized());
  }
}
