package io.trektribe.backend.notification.fanout;

import java.util.List;

/** Informational outcome of a fan-out. A non-empty failed list never undoes anything. */
public record FanOutResult(List<String> succeeded, List<FanOutFailure> failed) {

  public FanOutResult {
    succeeded = List.copyOf(succeeded);
    failed = List.copyOf(failed);
  }

  public int total() {
    return succeeded.size() + failed.size();
  }
}
