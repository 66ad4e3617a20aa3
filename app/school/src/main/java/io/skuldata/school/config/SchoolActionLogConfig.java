/*
 * どこで: School アプリの設定
 * 何を: action-log ライブラリと共通 Clock をアプリへ組み込む
 * なぜ: @WebMvcTest のスライスにライブラリ全体を持ち込まないよう、取り込みを独立した設定にするため
 */
package io.skuldata.school.config;

import io.skuldata.actionlog.config.ActionLogConfiguration;
import io.skuldata.common.config.TimeConfig;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({TimeConfig.class, ActionLogConfiguration.class})
public class SchoolActionLogConfig {}
