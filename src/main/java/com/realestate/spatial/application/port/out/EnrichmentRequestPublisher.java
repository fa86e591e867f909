package com.realestate.spatial.application.port.out;

import com.realestate.spatial.application.dto.EnrichmentRequestEvent;

/**
 * Output port for handing a batch request to the background worker.
 */
public interface EnrichmentRequestPublisher {

  void publish(EnrichmentRequestEvent event);
}
