package com.flamingo.ai.factcheck.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Client for the knowledge index node. A hosted cluster is reached with an API key; a local node
 * with security disabled needs none.
 */
@Configuration
@Slf4j
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.api-key:}")
  private String apiKey;

  @Bean(destroyMethod = "close")
  public Rest5Client knowledgeIndexRestClient() {
    Header[] headers = defaultHeaders(apiKey);
    log.info(
        "Knowledge index node {}://{}:{} (api key: {})",
        scheme,
        host,
        port,
        headers.length > 0 ? "set" : "none");
    return Rest5Client.builder(new HttpHost(scheme, host, port))
        .setDefaultHeaders(headers)
        .build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(Rest5Client knowledgeIndexRestClient) {
    return new Rest5ClientTransport(knowledgeIndexRestClient, new JacksonJsonpMapper());
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport elasticsearchTransport) {
    return new ElasticsearchClient(elasticsearchTransport);
  }

  @VisibleForTesting
  static Header[] defaultHeaders(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      return new Header[0];
    }
    return new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + apiKey.trim())};
  }
}
