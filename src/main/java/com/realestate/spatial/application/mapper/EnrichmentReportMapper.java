package com.realestate.spatial.application.mapper;

import com.realestate.spatial.api.dto.BulkGeocodeReportDto;
import com.realestate.spatial.domain.model.EnrichmentReport;
import org.springframework.stereotype.Component;

@Component
public class EnrichmentReportMapper {

  public BulkGeocodeReportDto toDto(EnrichmentReport report) {
    return new BulkGeocodeReportDto(
        report.getAttempted(),
        report.getSucceeded(),
        report.getFailed(),
        report.getRemaining(),
        report.getAverageLatencyMs(),
        report.isCancelled());
  }
}
