package com.vireo.util;

import java.lang.management.ManagementFactory;
import java.lang.management.RuntimeMXBean;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Properties;

/**
 * Start-up banner with a short summary of the running server.
 */
public final class Banner {

    private static final String[] VIREO_BANNER = {
        " __     __ ___  ____   _____   ___  ",
        " \\ \\   / /|_ _||  _ \\ | ____| / _ \\ ",
        "  \\ \\ / /  | | | |_) ||  _|  | | | |",
        "   \\ V /   | | |  _ < | |___ | |_| |",
        "    \\_/   |___||_| \\_\\|_____| \\___/ ",
        ""
    };

    private Banner() {
    }

    /**
     * Generates the banner.
     *
     * @param host host the server is bound to
     * @param port port the server is listening on
     * @param routeCount number of registered routes
     * @return the formatted banner string
     */
    public static String generate(String host, int port, int routeCount) {
        StringBuilder sb = new StringBuilder();
        String lineSeparator = System.lineSeparator();

        for (String line : VIREO_BANNER) {
            sb.append(ConsoleColors.paint(ConsoleColors.BLUE_BOLD, line)).append(lineSeparator);
        }

        Properties props = System.getProperties();
        RuntimeMXBean runtimeMx = ManagementFactory.getRuntimeMXBean();

        sb.append(ConsoleColors.paint(ConsoleColors.CYAN_BOLD, " :: Vireo ::"))
            .append("  ")
            .append(ConsoleColors.paint(ConsoleColors.WHITE_BOLD, "(v" + version() + ")"))
            .append(lineSeparator).append(lineSeparator);

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
        appendLine(sb, "Started at", timestamp);
        appendLine(sb, "Server URL", "http://" + ("0.0.0.0".equals(host) ? "localhost" : host) + ":" + port);
        appendLine(sb, "Routes", String.valueOf(routeCount));
        appendLine(sb, "Java", props.getProperty("java.version") + " (" + props.getProperty("java.vendor") + ")");
        appendLine(sb, "JVM", runtimeMx.getVmName() + " " + runtimeMx.getVmVersion());
        appendLine(sb, "Processors", String.valueOf(Runtime.getRuntime().availableProcessors()));

        return sb.toString();
    }

    /**
     * Prints the banner to standard output.
     *
     * @param host host the server is bound to
     * @param port port the server is listening on
     * @param routeCount number of registered routes
     */
    public static void display(String host, int port, int routeCount) {
        System.out.println(generate(host, port, routeCount));
    }

    private static void appendLine(StringBuilder sb, String label, String value) {
        sb.append(ConsoleColors.paint(ConsoleColors.PURPLE, String.format(" %-11s", label + ":")))
            .append(ConsoleColors.paint(ConsoleColors.WHITE, value))
            .append(System.lineSeparator());
    }

    private static String version() {
        String version = Banner.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
