/*
 * どこで: Action log ライブラリのエントリポイント
 * 何を: エンジン一式 (codec/store/dispatcher/observer/interceptor) を Bean 登録する
 * なぜ: ホストアプリが @Import 1 つで監査ログ基盤を組み込めるようにするため
 */
package io.skuldata.actionlog.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ActionLogProperties.class)
@ComponentScan(basePackages = "io.skuldata.actionlog")
public class ActionLogConfiguration {}
