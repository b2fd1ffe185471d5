package io.ircd.sslinfo;

import io.ircd.entity.Reply;
import io.ircd.entity.ReplySink;

import java.util.ArrayList;
import java.util.List;

final class RecordingSink implements ReplySink {
  private final List<Reply> replies = new ArrayList<>();

  @Override
  public void write(Reply reply) {
    replies.add(reply);
  }

  List<String> notices() {
    return replies.stream()
        .filter(r -> r instanceof Reply.Notice)
        .map(r -> ((Reply.Notice) r).text())
        .toList();
  }

  List<Reply.Numeric> numerics() {
    return replies.stream()
        .filter(r -> r instanceof Reply.Numeric)
        .map(r -> (Reply.Numeric) r)
        .toList();
  }

  List<Integer> codes() {
    return numerics().stream().map(Reply.Numeric::code).toList();
  }

  void clear() {
    replies.clear();
  }
}
