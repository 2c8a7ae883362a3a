package com.scholary.videoengine.monitoring;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds Kibana Discover links for pipeline logs.
 *
 * <p>Queries match the MDC fields written by {@code StructuredLogger}.
 */
@Component
public class KibanaUrlGenerator {

  private final String kibanaBaseUrl;
  private final String indexPattern;

  public KibanaUrlGenerator(
      @Value("${kibana.baseUrl:http://localhost:5601}") String kibanaBaseUrl,
      @Value("${kibana.indexPattern:videoengine-logs-*}") String indexPattern) {
    this.kibanaBaseUrl = kibanaBaseUrl;
    this.indexPattern = indexPattern;
  }

  /** Logs of one Video, including those of its Segments. */
  public String generateVideoUrl(String videoId, Iterable<String> segmentIds) {
    StringBuilder query = new StringBuilder();
    query.append(String.format("videoId:\"%s\" or entityId:\"%s\"", videoId, videoId));
    for (String segmentId : segmentIds) {
      query.append(String.format(" or entityId:\"%s\"", segmentId));
    }
    return discoverUrl(query.toString());
  }

  private String discoverUrl(String query) {
    String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);
    return String.format(
        "%s/app/discover#/?_a=(index:'%s',query:(language:kuery,query:'%s'))",
        kibanaBaseUrl, indexPattern, encodedQuery);
  }
}
