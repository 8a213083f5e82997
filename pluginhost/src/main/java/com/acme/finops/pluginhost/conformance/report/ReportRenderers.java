package com.acme.finops.pluginhost.conformance.report;

import com.acme.finops.pluginhost.conformance.ConformanceReport;
import com.acme.finops.pluginhost.conformance.PluginUnderTest;
import com.acme.finops.pluginhost.conformance.Summary;
import com.acme.finops.pluginhost.conformance.TestResult;
import com.acme.finops.pluginhost.conformance.TestStatus;
import com.acme.finops.pluginhost.conformance.Verbosity;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.util.PluginHostDefaults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Pure projections of a {@link ConformanceReport}. None of them mutate the report or do I/O.
 */
public final class ReportRenderers {

    private ReportRenderers() {
    }

    // ---- Table ----

    public static String table(ConformanceReport report) {
        return table(report, Verbosity.NORMAL);
    }

    public static String table(ConformanceReport report, Verbosity verbosity) {
        StringBuilder out = new StringBuilder();
        PluginUnderTest plugin = report.plugin();
        out.append("CONFORMANCE TEST RESULTS\n");
        out.append("========================\n");
        out.append(String.format(Locale.ROOT, "Plugin: %s v%s (protocol v%s)%n",
            plugin.name(), plugin.version(), plugin.protocolVersion()));
        out.append("Mode:   ").append(plugin.commMode().toUpperCase(Locale.ROOT)).append('\n');
        report.fault().ifPresent(f -> out.append("Plugin error: ").append(firstLine(f)).append('\n'));
        out.append('\n');

        out.append("TESTS\n");
        out.append("-----\n");
        for (TestResult r : report.results()) {
            out.append(String.format(Locale.ROOT, "%s %-45s [%7s]%n", icon(r.status()), r.name(), formatDuration(r.duration())));
            if (!r.error().isEmpty() && (r.status() == TestStatus.FAIL || r.status() == TestStatus.ERROR)) {
                out.append("  Error: ").append(r.error()).append('\n');
            }
            if (r.status() == TestStatus.SKIP && !r.details().isEmpty()) {
                out.append("  (").append(r.details()).append(")\n");
            }
            if (verbosity.compareTo(Verbosity.VERBOSE) >= 0 && r.status() == TestStatus.PASS && !r.details().isEmpty()) {
                out.append("  ").append(r.details()).append('\n');
            }
        }
        out.append('\n');

        Summary s = report.summary();
        out.append("SUMMARY\n");
        out.append("-------\n");
        out.append(String.format(Locale.ROOT, "Total: %d | Passed: %d | Failed: %d | Skipped: %d | Duration: %s%n",
            s.total(), s.passed(), s.failed(), s.skipped(), formatTotalDuration(report.duration())));
        if (s.errors() > 0) {
            out.append("Errors: ").append(s.errors()).append('\n');
        }
        return out.toString();
    }

    static String icon(TestStatus status) {
        return switch (status) {
            case PASS -> "✓";
            case FAIL -> "✗";
            case SKIP -> "⊘";
            case ERROR -> "!";
        };
    }

    static String formatDuration(Duration d) {
        if (d.isZero()) {
            return "  --  ";
        }
        if (d.toMillis() < 1) {
            return String.format(Locale.ROOT, "%5dμs", d.toNanos() / 1_000L);
        }
        return String.format(Locale.ROOT, "%5dms", d.toMillis());
    }

    static String formatTotalDuration(Duration d) {
        double seconds = d.toNanos() / 1e9;
        if (d.compareTo(Duration.ofMinutes(1)) >= 0) {
            return String.format(Locale.ROOT, "%.1fm", seconds / 60.0);
        }
        return String.format(Locale.ROOT, "%.1fs", seconds);
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }

    // ---- JSON ----

    public static String json(ConformanceReport report) {
        ObjectNode root = JsonCodec.objectNode();
        root.put("suite", report.suiteName());

        ObjectNode plugin = root.putObject("plugin");
        plugin.put("path", report.plugin().path());
        plugin.put("name", report.plugin().name());
        plugin.put("version", report.plugin().version());
        plugin.put("protocol_version", report.plugin().protocolVersion());
        plugin.put("comm_mode", report.plugin().commMode());

        ArrayNode results = root.putArray("results");
        for (TestResult r : report.results()) {
            ObjectNode node = results.addObject();
            node.put("name", r.name());
            node.put("category", r.category().wireName());
            node.put("status", r.status().wireName());
            node.put("duration_ms", r.duration().toMillis());
            if (!r.error().isEmpty()) {
                node.put("error", r.error());
            }
            if (!r.details().isEmpty()) {
                node.put("details", r.details());
            }
        }

        Summary s = report.summary();
        ObjectNode summary = root.putObject("summary");
        summary.put("total", s.total());
        summary.put("passed", s.passed());
        summary.put("failed", s.failed());
        summary.put("skipped", s.skipped());
        summary.put("errors", s.errors());

        root.put("duration_ms", report.duration().toMillis());
        root.put("timestamp", rfc3339(report.timestamp()));
        if (report.fault().isPresent()) {
            root.put("plugin_error", report.pluginFault());
            report.faultKind().ifPresent(k -> root.put("plugin_error_kind", k.name()));
        }
        try {
            return JsonCodec.writePretty(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render report as JSON", e);
        }
    }

    static String rfc3339(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }

    // ---- JUnit XML ----

    public static String junit(ConformanceReport report) {
        Summary s = report.summary();
        int failures = s.failed() + s.errors();
        String totalTime = String.format(Locale.ROOT, "%.1f", report.duration().toNanos() / 1e9);
        StringWriter buffer = new StringWriter();
        try {
            XMLStreamWriter xml = XMLOutputFactory.newFactory().createXMLStreamWriter(buffer);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeCharacters("\n");
            xml.writeStartElement("testsuites");
            xml.writeAttribute("name", PluginHostDefaults.JUNIT_SUITES_NAME);
            xml.writeAttribute("tests", String.valueOf(s.total()));
            xml.writeAttribute("failures", String.valueOf(failures));
            xml.writeAttribute("skipped", String.valueOf(s.skipped()));
            xml.writeAttribute("time", totalTime);

            indent(xml, 1);
            xml.writeStartElement("testsuite");
            xml.writeAttribute("name", xmlSafe(report.suiteName()));
            xml.writeAttribute("tests", String.valueOf(s.total()));
            xml.writeAttribute("failures", String.valueOf(failures));
            xml.writeAttribute("skipped", String.valueOf(s.skipped()));
            xml.writeAttribute("time", totalTime);
            xml.writeAttribute("timestamp", rfc3339(report.timestamp()));

            indent(xml, 2);
            xml.writeStartElement("properties");
            property(xml, "plugin.name", report.plugin().name());
            property(xml, "plugin.version", report.plugin().version());
            property(xml, "protocol.version", report.plugin().protocolVersion());
            indent(xml, 2);
            xml.writeEndElement();

            for (TestResult r : report.results()) {
                testcase(xml, r);
            }
            indent(xml, 1);
            xml.writeEndElement();
            xml.writeCharacters("\n");
            xml.writeEndElement();
            xml.writeCharacters("\n");
            xml.writeEndDocument();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("cannot render report as JUnit XML", e);
        }
        return buffer.toString();
    }

    private static void testcase(XMLStreamWriter xml, TestResult r) throws XMLStreamException {
        indent(xml, 2);
        xml.writeStartElement("testcase");
        xml.writeAttribute("name", xmlSafe(r.name()));
        xml.writeAttribute("classname", r.category().wireName());
        xml.writeAttribute("time", String.format(Locale.ROOT, "%.2f", r.duration().toNanos() / 1e9));
        switch (r.status()) {
            case FAIL, ERROR -> {
                indent(xml, 3);
                xml.writeStartElement("failure");
                xml.writeAttribute("message", xmlSafe(r.error()));
                xml.writeAttribute("type", r.status() == TestStatus.ERROR ? "Error" : "AssertionError");
                xml.writeCharacters(xmlSafe(r.error()));
                xml.writeEndElement();
                indent(xml, 2);
            }
            case SKIP -> {
                indent(xml, 3);
                xml.writeEmptyElement("skipped");
                if (!r.details().isEmpty()) {
                    xml.writeAttribute("message", xmlSafe(r.details()));
                }
                indent(xml, 2);
            }
            case PASS -> {
            }
        }
        xml.writeEndElement();
    }

    private static void property(XMLStreamWriter xml, String name, String value) throws XMLStreamException {
        indent(xml, 3);
        xml.writeEmptyElement("property");
        xml.writeAttribute("name", name);
        xml.writeAttribute("value", xmlSafe(value));
    }

    /**
     * Replaces code points XML 1.0 cannot carry (C0 controls other than tab, CR and LF, lone surrogates,
     * U+FFFE and U+FFFF) with U+FFFD.
     */
    static String xmlSafe(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = null;
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            int width = Character.charCount(cp);
            boolean allowed = cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
            if (!allowed && out == null) {
                out = new StringBuilder(value.length()).append(value, 0, i);
            }
            if (out != null) {
                if (allowed) {
                    out.appendCodePoint(cp);
                } else {
                    out.append('\uFFFD');
                }
            }
            i += width;
        }
        return out == null ? value : out.toString();
    }

    private static void indent(XMLStreamWriter xml, int depth) throws XMLStreamException {
        xml.writeCharacters("\n" + "  ".repeat(depth));
    }
}
