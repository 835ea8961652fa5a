package com.ecoauditor.core.renderer.impl;

import com.ecoauditor.core.renderer.GeneratedFile;
import com.ecoauditor.core.renderer.GeneratedOutput;
import com.ecoauditor.core.renderer.OutputRenderer;
import com.ecoauditor.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints generated files to standard output.
 *
 * <p>By default the content is printed as-is, so it can be piped into other tools.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.headers} - print a header naming each file ("true"/"false", default: "false")</li>
 *   <li>{@code console.colors} - ANSI colors for headers ("true"/"false", default: "false")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.headers", "false"));
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        logger.debug("Rendering {} files to console (headers: {}, colors: {})",
            output.files().size(), showHeaders, useColors);

        for (GeneratedFile file : output.files()) {
            if (showHeaders) {
                String prefix = useColors ? ANSI_BOLD_CYAN : "";
                String suffix = useColors ? ANSI_RESET : "";
                out.println(prefix + "== " + file.relativePath() + " ==" + suffix);
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.flush();
    }
}
