package io.skuldata.actionlog.query;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongFunction;

/**
 * 型タグ 1 つ分の対象解決。ホストアプリが Bean として登録する。
 *
 * <p>対象が削除済みなら空を返す。例外は投げないこと。
 */
public interface ActionTargetResolver {

  String typeTag();

  Optional<String> resolveDisplay(long id);

  static ActionTargetResolver of(String typeTag, LongFunction<Optional<String>> lookup) {
    Objects.requireNonNull(typeTag, "typeTag");
    Objects.requireNonNull(lookup, "lookup");
    return new ActionTargetResolver() {
      @Override
      public String typeTag() {
        return typeTag;
      }

      @Override
      public Optional<String> resolveDisplay(long id) {
        return lookup.apply(id);
      }
    };
  }
}
