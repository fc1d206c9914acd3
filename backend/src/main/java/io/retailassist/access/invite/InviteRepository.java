package io.retailassist.access.invite;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InviteRepository extends JpaRepository<Invite, UUID> {

  Optional<Invite> findByTokenHash(String tokenHash);

  List<Invite> findByWorkspaceIdAndStatusOrderByCreatedAtDesc(UUID workspaceId, InviteStatus status);

  List<Invite> findByStatusOrderByCreatedAtDesc(InviteStatus status);

  /**
   * Moves a pending invite to accepted. Returns 0 if another caller already moved it out of
   * pending.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE Invite i SET i.status = io.retailassist.access.invite.InviteStatus.ACCEPTED,
          i.acceptedAt = :now
      WHERE i.id = :id AND i.status = io.retailassist.access.invite.InviteStatus.PENDING
      """)
  int markAccepted(@Param("id") UUID id, @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE Invite i SET i.status = io.retailassist.access.invite.InviteStatus.REVOKED,
          i.revokedAt = :now
      WHERE i.id = :id AND i.status = io.retailassist.access.invite.InviteStatus.PENDING
      """)
  int markRevoked(@Param("id") UUID id, @Param("now") Instant now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE Invite i SET i.status = io.retailassist.access.invite.InviteStatus.EXPIRED
      WHERE i.id = :id AND i.status = io.retailassist.access.invite.InviteStatus.PENDING
      """)
  int markExpired(@Param("id") UUID id);

  /** Expires every pending invite whose deadline has passed. */
  @Modifying
  @Query(
      """
      UPDATE Invite i SET i.status = io.retailassist.access.invite.InviteStatus.EXPIRED
      WHERE i.status = io.retailassist.access.invite.InviteStatus.PENDING AND i.expiresAt < :now
      """)
  int expireOverdue(@Param("now") Instant now);
}
