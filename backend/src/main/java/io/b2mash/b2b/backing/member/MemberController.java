package io.b2mash.b2b.backing.member;

import io.b2mash.b2b.backing.security.ActorContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/collectives")
public class MemberController {

  private final MemberService memberService;

  public MemberController(MemberService memberService) {
    this.memberService = memberService;
  }

  @PostMapping("/{collectiveRef}/members")
  public ResponseEntity<MemberView> createMember(
      @PathVariable String collectiveRef, @Valid @RequestBody CreateMemberRequest request) {
    var view =
        memberService.createMember(
            ActorContext.getCurrentActor(),
            request.email(),
            request.name(),
            collectiveRef,
            request.role());
    return ResponseEntity.created(
            URI.create("/api/collectives/" + collectiveRef + "/members/" + view.id()))
        .body(view);
  }

  @DeleteMapping("/{collectiveId}/members")
  public ResponseEntity<Void> removeMember(
      @PathVariable UUID collectiveId,
      @RequestParam UUID userId,
      @RequestParam(defaultValue = "FOLLOWER") MemberRole role) {
    memberService.removeMember(ActorContext.getCurrentActor(), userId, collectiveId, role);
    return ResponseEntity.noContent().build();
  }

  public record CreateMemberRequest(
      @NotBlank(message = "email is required") @Email(message = "email must be valid")
          String email,
      String name,
      @NotNull(message = "role is required") MemberRole role) {}
}
