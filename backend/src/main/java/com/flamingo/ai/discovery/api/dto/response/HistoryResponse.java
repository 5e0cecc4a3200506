package com.flamingo.ai.discovery.api.dto.response;

import com.flamingo.ai.discovery.service.history.HistoryEntry;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a user's search history, newest first. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryResponse {

  private List<HistoryEntry> history;
}
