/*
 * どこで: School API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package io.skuldata.school.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  FORBIDDEN
}
