/*
 * どこで: Action log ドメインモデル
 * 何を: 操作ログの分類を閉じた列挙として定義する
 * なぜ: 検索フィルタと画面表示で同じ分類を使うため
 */
package io.skuldata.actionlog.model;

public enum ActionCategory {
  CREATE("Create"),
  UPDATE("Update"),
  DELETE("Delete"),
  VIEW("View"),
  LOGIN("Login"),
  LOGOUT("Logout"),
  UPLOAD("Upload"),
  DOWNLOAD("Download"),
  SHARE("Share"),
  SYSTEM("System"),
  OTHER("Other");

  private final String label;

  ActionCategory(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
