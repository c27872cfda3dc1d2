package io.b2mash.governance.cdc;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends change notifications to the outbox. Each event is written in its own transaction, so an
 * event describing a failed (rolled back) policy still lands.
 */
@Service
public class ChangeDataCaptureService {

  private static final Logger log = LoggerFactory.getLogger(ChangeDataCaptureService.class);

  private final ChangeEventRepository changeEventRepository;
  private final Clock clock;

  public ChangeDataCaptureService(ChangeEventRepository changeEventRepository, Clock clock) {
    this.changeEventRepository = changeEventRepository;
    this.clock = clock;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public ChangeEvent recordEvent(ChangeEventRequest request) {
    if (request.domain() == null || request.operation() == null) {
      throw new IllegalArgumentException("domain and operation are required");
    }
    var saved = changeEventRepository.save(new ChangeEvent(request, clock.instant()));
    log.debug(
        "Recorded change event {} {}/{} entityId={} dryRun={}",
        request.operation(),
        request.domain(),
        request.entityName(),
        request.entityId(),
        request.dryRun());
    return saved;
  }
}
