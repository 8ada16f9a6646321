/*
 * どこで: Survey 起動時復旧
 * 何を: 未来の送信予定を再登録するかどうかを運用者に y/n で確認する
 * なぜ: 調査を中断して再開するのか、やり直すのかは運用者にしか判断できないため
 */
package com.example.survey.recovery;

import com.example.survey.model.RecoveryDecision;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public class ConsoleRecoveryDecisionProvider implements RecoveryDecisionProvider {

  private final BufferedReader reader;
  private final PrintStream out;

  public ConsoleRecoveryDecisionProvider(InputStream in, PrintStream out) {
    this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    this.out = out;
  }

  @Override
  public RecoveryDecision decide(int futureSlotCount) {
    out.println(futureSlotCount + " scheduled survey jobs found in the future.");
    while (true) {
      out.print("Reschedule them? (y = reschedule, n = delete all pending surveys): ");
      out.flush();
      final String line;
      try {
        line = reader.readLine();
      } catch (IOException ex) {
        throw new UncheckedIOException("failed to read recovery decision", ex);
      }
      if (line == null) {
        throw new IllegalStateException("recovery decision input closed before an answer was given");
      }
      switch (line.trim().toLowerCase(Locale.ROOT)) {
        case "y", "yes" -> {
          return RecoveryDecision.RESCHEDULE;
        }
        case "n", "no" -> {
          return RecoveryDecision.DISCARD;
        }
        default -> out.println("Please answer y or n.");
      }
    }
  }
}
