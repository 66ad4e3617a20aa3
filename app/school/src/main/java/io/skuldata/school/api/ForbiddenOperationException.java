package io.skuldata.school.api;

/** 認証済みだが、対象に対する操作が許可されていない場合に投げる。 */
public class ForbiddenOperationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ForbiddenOperationException(String message) {
    super(message);
  }
}
