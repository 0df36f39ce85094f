package com.batrun.report;

import picocli.CommandLine;

import java.io.PrintStream;
import java.time.Duration;

/**
 * ANSI-colored terminal output for batrun, written with picocli's markup
 * ({@code @|fg(green) text|@}).
 */
public class ConsoleOutput {

    private final PrintStream out;
    private final CommandLine.Help.Ansi ansi;

    public ConsoleOutput() {
        this(System.out, CommandLine.Help.Ansi.AUTO);
    }

    public ConsoleOutput(PrintStream out, CommandLine.Help.Ansi ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    public void println(String markup) {
        out.println(ansi.string(markup));
    }

    public void println() {
        out.println();
    }

    public void print(String markup) {
        out.print(ansi.string(markup));
    }

    public void flush() {
        out.flush();
    }

    public static String bold(String text) {
        return "@|bold " + text + "|@";
    }

    public static String green(String text) {
        return "@|fg(green) " + text + "|@";
    }

    public static String red(String text) {
        return "@|fg(red) " + text + "|@";
    }

    public static String yellow(String text) {
        return "@|fg(yellow) " + text + "|@";
    }

    public static String cyan(String text) {
        return "@|fg(cyan) " + text + "|@";
    }

    public static String faint(String text) {
        return "@|faint " + text + "|@";
    }

    /**
     * Formats a duration as {@code 1h 1m 1s}, {@code 1m 1s} or {@code 1s};
     * sub-second parts are dropped.
     */
    public static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) return hours + "h " + minutes + "m " + secs + "s";
        if (minutes > 0) return minutes + "m " + secs + "s";
        return secs + "s";
    }
}
