package io.skuldata.actionlog.query;

import java.util.UUID;

/** ログ参照時に添えるアクターの現在のプロフィール。 */
public record ActorDetails(
    long id,
    UUID userTag,
    String username,
    String email,
    String firstName,
    String lastName,
    String role) {}
