package io.retailassist.access.audit;

/** Records audit events for invite transitions, grant changes and access denials. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is rolled back with it.
   */
  void log(AuditEventRecord record);
}
