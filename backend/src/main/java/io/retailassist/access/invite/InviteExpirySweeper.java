package io.retailassist.access.invite;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Moves overdue pending invites to expired in bulk. Lookups expire invites lazily as well, so the
 * sweep only keeps listings and audit queries tidy; it never changes a terminal invite.
 */
@Component
public class InviteExpirySweeper {

  private static final Logger log = LoggerFactory.getLogger(InviteExpirySweeper.class);

  private final InviteRepository inviteRepository;
  private final TransactionTemplate transactionTemplate;

  public InviteExpirySweeper(
      InviteRepository inviteRepository, TransactionTemplate transactionTemplate) {
    this.inviteRepository = inviteRepository;
    this.transactionTemplate = transactionTemplate;
  }

  @Scheduled(
      fixedDelayString = "${access.invite.sweep-interval:PT1H}",
      initialDelayString = "${access.invite.sweep-interval:PT1H}")
  public void expireOverdueInvites() {
    try {
      Integer expired =
          transactionTemplate.execute(status -> inviteRepository.expireOverdue(Instant.now()));
      if (expired != null && expired > 0) {
        log.info("Expired {} overdue pending invites", expired);
      }
    } catch (RuntimeException e) {
      log.warn("Failed to expire overdue invites: {}", e.getMessage());
    }
  }
}
