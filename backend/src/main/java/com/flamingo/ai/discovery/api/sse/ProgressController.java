package com.flamingo.ai.discovery.api.sse;

import com.flamingo.ai.discovery.api.RequestIdentityResolver;
import com.flamingo.ai.discovery.config.DiscoveryConfig;
import com.flamingo.ai.discovery.progress.ProgressEvent;
import com.flamingo.ai.discovery.progress.SseProgressPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Streams discovery progress for the calling user as Server-Sent Events. */
@RestController
@RequestMapping("/api/playlist-discovery")
@RequiredArgsConstructor
@Slf4j
public class ProgressController {

  private final SseProgressPublisher progressPublisher;
  private final RequestIdentityResolver identityResolver;
  private final DiscoveryConfig discoveryConfig;

  /**
   * Subscribes to progress events. Browsers' EventSource cannot set headers, so the user id may
   * also be passed as a query parameter.
   */
  @GetMapping(value = "/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<ProgressEvent>> progress(
      @RequestHeader(value = RequestIdentityResolver.USER_HEADER, required = false)
          String userHeader,
      @RequestParam(value = "userId", required = false) String userParam) {
    String userId = identityResolver.requireUser(userHeader != null ? userHeader : userParam);
    String eventName = discoveryConfig.getProgress().getEventName();
    log.debug("Progress stream opened");
    return progressPublisher
        .subscribe(userId)
        .map(event -> ServerSentEvent.builder(event).event(eventName).build());
  }
}
