package io.b2mash.b2b.backing.member;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  @Query(
      """
      SELECT DISTINCT m.memberCollectiveId FROM Member m
      WHERE m.collectiveId = :collectiveId AND m.role IN :roles
      """)
  List<UUID> findMemberCollectiveIds(
      @Param("collectiveId") UUID collectiveId, @Param("roles") Collection<MemberRole> roles);

  boolean existsByCollectiveIdAndMemberCollectiveIdAndRoleIn(
      UUID collectiveId, UUID memberCollectiveId, Collection<MemberRole> roles);

  List<Member> findByCollectiveIdAndMemberCollectiveIdAndRole(
      UUID collectiveId, UUID memberCollectiveId, MemberRole role);

  List<Member> findByCollectiveIdAndRole(UUID collectiveId, MemberRole role);

  long countByCollectiveIdAndRole(UUID collectiveId, MemberRole role);
}
