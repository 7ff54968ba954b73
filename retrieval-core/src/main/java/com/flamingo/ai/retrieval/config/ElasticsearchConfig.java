package com.flamingo.ai.retrieval.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch client for the vector index backend. Active only with {@code
 * rag.index.backend=elasticsearch}; an {@code elasticsearch.api-key} is sent as an {@code ApiKey}
 * authorization header.
 */
@Configuration
@ConditionalOnProperty(name = "rag.index.backend", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchConfig {

  @Bean
  public Rest5Client rest5Client(
      @Value("${elasticsearch.scheme:http}") String scheme,
      @Value("${elasticsearch.host:localhost}") String host,
      @Value("${elasticsearch.port:9200}") int port,
      @Value("${elasticsearch.api-key:}") String apiKey) {
    Rest5ClientBuilder builder = Rest5Client.builder(new HttpHost(scheme, host, port));
    if (apiKey != null && !apiKey.isBlank()) {
      builder.setDefaultHeaders(
          new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "ApiKey " + apiKey)});
    }
    log.info("Elasticsearch vector backend at {}://{}:{}", scheme, host, port);
    return builder.build();
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(Rest5Client rest5Client) {
    return new ElasticsearchClient(
        new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper()));
  }
}
