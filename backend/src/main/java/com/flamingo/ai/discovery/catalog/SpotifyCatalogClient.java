package com.flamingo.ai.discovery.catalog;

import com.flamingo.ai.discovery.catalog.dto.CatalogPage;
import com.flamingo.ai.discovery.catalog.dto.CatalogPlaylist;
import com.flamingo.ai.discovery.catalog.dto.CatalogSearchResponse;
import com.flamingo.ai.discovery.catalog.dto.CatalogTrackItem;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.exception.CatalogAuthException;
import com.flamingo.ai.discovery.exception.CatalogException;
import com.flamingo.ai.discovery.exception.CatalogRateLimitException;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** WebClient-backed client for the Spotify Web API playlist endpoints. */
@Component
@Slf4j
public class SpotifyCatalogClient implements CatalogClient {

  private static final ParameterizedTypeReference<CatalogPage<CatalogTrackItem>> TRACK_PAGE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final Duration timeout;

  public SpotifyCatalogClient(DiscoveryConfig discoveryConfig, WebClient.Builder builder) {
    DiscoveryConfig.Catalog catalog = discoveryConfig.getCatalog();
    this.timeout = catalog.getTimeout();
    this.webClient =
        builder
            .baseUrl(catalog.getBaseUrl())
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(catalog.getMaxInMemorySize()))
            .build();
    log.info("Catalog client initialized: baseUrl={}", catalog.getBaseUrl());
  }

  @Override
  public CatalogPage<CatalogPlaylist> searchPlaylists(
      String accessToken, String query, int limit, int offset) {
    log.debug("Catalog search '{}' (limit={}, offset={})", query, limit, offset);
    CatalogSearchResponse response =
        call(
            "search",
            () ->
                webClient
                    .get()
                    .uri(
                        uri ->
                            uri.path("/search")
                                .queryParam("q", "{q}")
                                .queryParam("type", "playlist")
                                .queryParam("limit", limit)
                                .queryParam("offset", offset)
                                .build(query))
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toCatalogException)
                    .bodyToMono(CatalogSearchResponse.class));
    if (response == null || response.playlists() == null) {
      return new CatalogPage<>(List.of(), 0, limit, offset);
    }
    return response.playlists();
  }

  @Override
  public CatalogPlaylist getPlaylist(String accessToken, String playlistId) {
    log.debug("Catalog playlist lookup {}", playlistId);
    CatalogPlaylist playlist =
        call(
            "playlist " + playlistId,
            () ->
                webClient
                    .get()
                    .uri("/playlists/{id}", playlistId)
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toCatalogException)
                    .bodyToMono(CatalogPlaylist.class));
    if (playlist == null) {
      throw new CatalogException("Empty playlist response for " + playlistId, 0);
    }
    return playlist;
  }

  @Override
  public CatalogPage<CatalogTrackItem> getPlaylistTracks(
      String accessToken, String playlistId, int limit, int offset) {
    log.debug("Catalog tracks for {} (limit={}, offset={})", playlistId, limit, offset);
    CatalogPage<CatalogTrackItem> page =
        call(
            "tracks " + playlistId,
            () ->
                webClient
                    .get()
                    .uri(
                        uri ->
                            uri.path("/playlists/{id}/tracks")
                                .queryParam("limit", limit)
                                .queryParam("offset", offset)
                                .build(playlistId))
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toCatalogException)
                    .bodyToMono(TRACK_PAGE));
    return page != null ? page : new CatalogPage<>(List.of(), 0, limit, offset);
  }

  private <T> T call(String operation, Supplier<Mono<T>> request) {
    try {
      return request.get().timeout(timeout).block();
    } catch (CatalogException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CatalogException("Catalog " + operation + " failed: " + e.getMessage(), e);
    }
  }

  private Mono<Throwable> toCatalogException(ClientResponse response) {
    HttpStatusCode status = response.statusCode();
    if (status.value() == HttpStatus.UNAUTHORIZED.value()) {
      return Mono.just(new CatalogAuthException("Catalog rejected the access token"));
    }
    if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
      Duration retryAfter =
          parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER));
      return Mono.just(new CatalogRateLimitException("Catalog rate limit exceeded", retryAfter));
    }
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(
            body ->
                new CatalogException(
                    "Catalog request failed with status " + status.value() + ": " + body,
                    status.value()));
  }

  static Duration parseRetryAfter(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      return Duration.ofSeconds(Long.parseLong(header.trim()));
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric Retry-After header '{}'", header);
      return null;
    }
  }
}
