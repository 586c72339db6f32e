package com.acme.hotdog.router.template;

import com.github.jknack.handlebars.EscapingStrategy;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.HandlebarsException;
import com.github.jknack.handlebars.Template;

import java.io.IOException;
import java.util.Objects;

/**
 * Compiles {@code {{placeholder}}} templates once at load time.
 *
 * <p>Output is plain text: HTML escaping is disabled, so log content passes
 * through untouched. Sources without {@code "{{"} skip Handlebars entirely.</p>
 */
public final class TemplateEngine {
    private static final String OPEN = "{{";

    private final Handlebars handlebars;

    public TemplateEngine() {
        Handlebars hb = new Handlebars().with(EscapingStrategy.NOOP);
        hb.setPrettyPrint(false);
        hb.setInfiniteLoops(false);
        this.handlebars = hb;
    }

    /**
     * @throws TemplateException when the source is not a valid template
     */
    public CompiledTemplate compile(String source) {
        Objects.requireNonNull(source, "source");
        if (!source.contains(OPEN)) {
            return CompiledTemplate.constant(source);
        }
        try {
            Template template = handlebars.compileInline(source);
            return CompiledTemplate.of(source, template);
        } catch (HandlebarsException | IOException e) {
            throw new TemplateException("invalid template '" + source + "': " + e.getMessage(), e);
        }
    }
}
