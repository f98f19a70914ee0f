package com.scholary.dubbing.monitoring;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generates Kibana URLs for job monitoring.
 *
 * <p>Creates direct links to Kibana Discover with a query on the {@code jobId} MDC field.
 */
@Component
public class KibanaUrlGenerator {

  private final String kibanaBaseUrl;
  private final String indexPattern;

  public KibanaUrlGenerator(
      @Value("${kibana.baseUrl:http://localhost:5601}") String kibanaBaseUrl,
      @Value("${kibana.indexPattern:dubbing-logs-*}") String indexPattern) {
    this.kibanaBaseUrl = kibanaBaseUrl;
    this.indexPattern = indexPattern;
  }

  /**
   * Generate Kibana Discover URL for a specific job.
   *
   * @param jobId the job ID to filter by
   * @return Kibana URL with pre-filtered query
   */
  public String generateJobUrl(String jobId) {
    // Format: /app/discover#/?_a=(index:'...',query:(language:kuery,query:'jobId:"abc-123"'))
    String query = String.format("jobId:\"%s\"", jobId);
    return String.format(
        "%s/app/discover#/?_a=(index:'%s',query:(language:kuery,query:'%s'))",
        kibanaBaseUrl, indexPattern, URLEncoder.encode(query, StandardCharsets.UTF_8));
  }
}
