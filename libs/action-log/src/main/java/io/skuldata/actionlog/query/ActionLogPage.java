package io.skuldata.actionlog.query;

import java.util.List;

public record ActionLogPage(List<ActionLogView> items, int page, int size, long total) {

  public ActionLogPage {
    items = List.copyOf(items);
  }

  public boolean hasNext() {
    return (long) (page + 1) * size < total;
  }
}
