package com.acme.relay.counters;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Process-wide activity counters as persisted in the counters file. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ActivityCounters {

  private long messagesRelayed;
  private long errorsEncountered;
  private Instant lastMessageAt;
  private Instant startedAt;

  @JsonProperty("lastSavedAt")
  private Instant lastPersistedAt;

  public static ActivityCounters fresh(Instant now) {
    return new ActivityCounters(0, 0, null, now, now);
  }

  public ActivityCounters copy() {
    return new ActivityCounters(
        messagesRelayed, errorsEncountered, lastMessageAt, startedAt, lastPersistedAt);
  }
}
