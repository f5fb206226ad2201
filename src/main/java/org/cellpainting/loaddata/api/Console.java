package org.cellpainting.loaddata.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.cellpainting.loaddata.application.pipeline.BindSummary;
import org.cellpainting.loaddata.application.pipeline.CombineSummary;
import org.cellpainting.loaddata.application.pipeline.GroupFailure;
import org.cellpainting.loaddata.domain.group.UnmatchedGroup;

/**
 * Stdout reports of the CLI: help text, dry-run plans and run summaries.
 *
 * <p>Reports bypass the logging backend, which writes to stderr, so scripts can read them directly. Each
 * report is a title line followed by {@code " <label>: <value>"} fields aligned on the colon.</p>
 */
final class Console {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final String FIELD = " %-18s: %s";
  private static volatile PrintWriter override;

  private Console() {}

  static void text(String block) {
    out().println(block.stripTrailing());
  }

  static void bindPlan(Map<String, Object> fields) {
    section("Bind dry-run: no files will be produced.", fields);
    out().println(" Re-run without --dry-run to write manifests.");
  }

  static void combinePlan(Map<String, Object> fields) {
    section("Combine dry-run: no files will be produced.", fields);
    out().println(" Re-run without --dry-run to write combined manifests.");
  }

  static void bindSummary(BindSummary summary) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("Images read", summary.imagesRead());
    fields.put("Corrections read", summary.correctionsRead());
    fields.put("Image groups", summary.imageGroups());
    fields.put("Manifests written", summary.written().size());
    fields.put("Unmatched groups", summary.unmatched().size());
    fields.put("Failed groups", summary.failures().size());
    section("Bind summary:", fields);
    for (UnmatchedGroup unmatched : summary.unmatched()) {
      out().println("  unmatched " + unmatched.imageGroup() + " (join key " + unmatched.joinKey() + ")");
    }
    failures(summary.failures());
  }

  static void combineSummary(CombineSummary summary) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("Handoff units", summary.unitsRead());
    fields.put("Manifests written", summary.written().size());
    fields.put("Failed groups", summary.failures().size());
    section("Combine summary:", fields);
    failures(summary.failures());
  }

  private static void failures(Iterable<GroupFailure> failures) {
    for (GroupFailure failure : failures) {
      out().println("  failed " + failure.groupId() + ": " + failure.reason());
    }
  }

  private static void section(String title, Map<String, Object> fields) {
    PrintWriter writer = out();
    writer.println(title);
    fields.forEach((label, value) -> writer.println(String.format(FIELD, label, value)));
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = override;
    return writer != null ? writer : STDOUT;
  }
}
