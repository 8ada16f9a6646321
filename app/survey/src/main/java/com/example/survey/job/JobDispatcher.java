/*
 * どこで: Survey ジョブ実行基盤
 * 何を: CallbackKind から JobHandler への対応表を持ち、発火したジョブを振り分ける
 * なぜ: ジョブにクロージャを持たせず、種別と時刻だけで処理を決められるようにするため
 */
package com.example.survey.job;

import com.example.survey.model.CallbackKind;
import com.example.survey.model.ScheduledJob;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class JobDispatcher {

  private final ObjectProvider<JobHandler> handlerProvider;
  private volatile Map<CallbackKind, JobHandler> handlers;

  // ハンドラはスケジューラに依存するため、初回の振り分け時に遅延解決する
  public JobDispatcher(ObjectProvider<JobHandler> handlerProvider) {
    this.handlerProvider = handlerProvider;
  }

  public void dispatch(ScheduledJob job) {
    final JobHandler handler = handlers().get(job.callbackKind());
    if (handler == null) {
      throw new IllegalStateException("no job handler registered callbackKind=" + job.callbackKind());
    }
    handler.handle(job);
  }

  private Map<CallbackKind, JobHandler> handlers() {
    Map<CallbackKind, JobHandler> current = handlers;
    if (current == null) {
      final Map<CallbackKind, JobHandler> table = new EnumMap<>(CallbackKind.class);
      handlerProvider.orderedStream()
          .forEach(
              handler -> {
                if (table.putIfAbsent(handler.callbackKind(), handler) != null) {
                  throw new IllegalStateException(
                      "duplicate job handler callbackKind=" + handler.callbackKind());
                }
              });
      current = table;
      handlers = current;
    }
    return current;
  }
}
