package com.flamingo.ai.discovery.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.discovery.domain.model.RequestIdentity;
import com.flamingo.ai.discovery.exception.MissingIdentityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RequestIdentityResolverTest {

  private final RequestIdentityResolver resolver = new RequestIdentityResolver();

  @Test
  @DisplayName("should read user, bearer token and session")
  void shouldResolveIdentity() {
    RequestIdentity identity = resolver.resolve(" user-1 ", "bearer abc123", null);

    assertThat(identity.userId()).isEqualTo("user-1");
    assertThat(identity.accessToken()).isEqualTo("abc123");
    assertThat(identity.sessionOrUnknown()).isEqualTo("unknown");
  }

  @Test
  @DisplayName("should reject a missing or malformed token")
  void shouldRejectBadToken() {
    assertThatThrownBy(() -> resolver.resolve("user-1", null, "s1"))
        .isInstanceOf(MissingIdentityException.class)
        .hasMessage("Missing catalog access token");
    assertThatThrownBy(() -> resolver.resolve("user-1", "Basic abc", "s1"))
        .isInstanceOf(MissingIdentityException.class);
    assertThatThrownBy(() -> resolver.resolve("user-1", "Bearer   ", "s1"))
        .isInstanceOf(MissingIdentityException.class);
  }

  @Test
  @DisplayName("should reject a missing user")
  void shouldRejectMissingUser() {
    assertThatThrownBy(() -> resolver.requireUser(" "))
        .isInstanceOf(MissingIdentityException.class)
        .hasMessage("User not authenticated");
  }
}
