/*
 * どこで: School の監査ログ連携
 * 何を: 型タグごとの対象表示名の解決手段を Bean として登録する
 * なぜ: ログ参照時に対象の現在の名前を表示し、削除済みなら「存在しない」と判別できるようにするため
 */
package io.skuldata.school.audit;

import io.skuldata.actionlog.query.ActionTargetResolver;
import io.skuldata.school.model.DocumentRecord;
import io.skuldata.school.model.LessonRecord;
import io.skuldata.school.model.StudentRecord;
import io.skuldata.school.model.TimetableRecord;
import io.skuldata.school.repository.DocumentRepository;
import io.skuldata.school.repository.StudentRepository;
import io.skuldata.school.repository.TimetableRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SchoolTargetResolverConfig {

  @Bean
  ActionTargetResolver studentTargetResolver(StudentRepository studentRepository) {
    return ActionTargetResolver.of(
        StudentRecord.TYPE_TAG,
        id -> studentRepository.findById(id).map(StudentRecord::displayName));
  }

  @Bean
  ActionTargetResolver documentTargetResolver(DocumentRepository documentRepository) {
    return ActionTargetResolver.of(
        DocumentRecord.TYPE_TAG,
        id -> documentRepository.findById(id).map(DocumentRecord::displayName));
  }

  @Bean
  ActionTargetResolver timetableTargetResolver(TimetableRepository timetableRepository) {
    return ActionTargetResolver.of(
        TimetableRecord.TYPE_TAG,
        id -> timetableRepository.findTimetable(id).map(TimetableRecord::displayName));
  }

  @Bean
  ActionTargetResolver lessonTargetResolver(TimetableRepository timetableRepository) {
    return ActionTargetResolver.of(
        LessonRecord.TYPE_TAG,
        id -> timetableRepository.findLessonById(id).map(LessonRecord::displayName));
  }
}
