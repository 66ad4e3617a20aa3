package io.skuldata.actionlog.web;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * パス形式ごとの metadata 抽出。ホストアプリが Bean として登録し、インターセプタが順に適用する。
 *
 * <p>対象外のパスでは空を返すこと。
 */
public interface RequestMetadataExtractor {

  Optional<PathContext> extract(String path, HttpServletRequest request);
}
