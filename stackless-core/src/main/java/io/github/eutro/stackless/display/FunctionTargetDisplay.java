package io.github.eutro.stackless.display;

import io.github.eutro.stackless.bytecode.Bytecode;
import io.github.eutro.stackless.env.SymbolPool;
import io.github.eutro.stackless.env.TypeDisplayContext;
import io.github.eutro.stackless.env.TypeParameter;
import io.github.eutro.stackless.target.AnnotationFormatter;
import io.github.eutro.stackless.target.FunctionTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;

/**
 * Renders a {@link FunctionTarget} as text, for debugging and for test expectations.
 * <p>
 * The output depends only on the target's snapshot and its registered formatters,
 * so rendering the same target twice gives the same text.
 */
public class FunctionTargetDisplay {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionTargetDisplay.class);

    private static final String INDENT = "    ";
    private static final String COMMENT = INDENT + "// ";

    public static String display(FunctionTarget target) {
        StringBuilder sb = new StringBuilder();
        display(target, sb);
        return sb.toString();
    }

    public static void display(FunctionTarget target, StringBuilder sb) {
        SymbolPool pool = target.symbolPool();
        TypeDisplayContext ctx = target.typeDisplayContext();

        if (target.isPublic()) sb.append("pub ");
        sb.append("fun ").append(target.getFullName());
        List<TypeParameter> typeParams = target.getTypeParameters();
        if (!typeParams.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < typeParams.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeParams.get(i).getName().display(pool));
            }
            sb.append('>');
        }
        sb.append('(');
        for (int i = 0; i < target.getParameterCount(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(target.displayLocal(i)).append(": ").append(target.getLocalType(i).display(ctx));
        }
        sb.append(')');
        int returnCount = target.getReturnCount();
        if (returnCount > 0) {
            sb.append(": ");
            if (returnCount > 1) sb.append('(');
            for (int i = 0; i < returnCount; i++) {
                if (i > 0) sb.append(", ");
                sb.append(target.getReturnType(i).display(ctx));
            }
            if (returnCount > 1) sb.append(')');
        }
        sb.append(" {\n");

        for (int i = target.getParameterCount(); i < target.getLocalCount(); i++) {
            sb.append(INDENT)
                    .append("var ")
                    .append(target.displayLocal(i))
                    .append(": ")
                    .append(target.getLocalType(i).display(ctx))
                    .append('\n');
        }

        List<AnnotationFormatter> formatters = target.getAnnotationFormatters();
        List<Bytecode> code = target.getBytecode();
        for (int offset = 0; offset < code.size(); offset++) {
            for (AnnotationFormatter formatter : formatters) {
                Optional<String> text = formatter.format(target, offset)
                        .map(FunctionTargetDisplay::stripTrailingNewline)
                        .filter(s -> !s.isEmpty());
                if (text.isPresent()) {
                    sb.append(COMMENT).append(text.get().replace("\n", "\n" + COMMENT)).append('\n');
                }
            }
            sb.append(INDENT).append(code.get(offset).display(target)).append('\n');
        }
        sb.append("}\n");
    }

    private static String stripTrailingNewline(String text) {
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }

    /**
     * Render a target to a file, creating its parent directories if necessary.
     *
     * @param target The target.
     * @param file   The file to write.
     */
    public static void debugDisplayToFile(FunctionTarget target, File file) {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            writer.write(display(target));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOGGER.debug("wrote {} to {}", target.getFullName(), file);
    }
}
