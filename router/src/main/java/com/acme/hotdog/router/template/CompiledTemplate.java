package com.acme.hotdog.router.template;

import com.github.jknack.handlebars.Template;

import java.io.IOException;
import java.util.Map;

/**
 * A template ready to render. Immutable and safe to share across workers.
 */
public final class CompiledTemplate {
    private final String source;
    private final Template template;

    private CompiledTemplate(String source, Template template) {
        this.source = source;
        this.template = template;
    }

    static CompiledTemplate constant(String text) {
        return new CompiledTemplate(text, null);
    }

    static CompiledTemplate of(String source, Template template) {
        return new CompiledTemplate(source, template);
    }

    public String source() {
        return source;
    }

    public boolean isConstant() {
        return template == null;
    }

    /**
     * Renders against a variable map. Unknown placeholders render as empty text.
     */
    public String render(Map<String, ?> variables) throws IOException {
        if (template == null) {
            return source;
        }
        return template.apply(variables);
    }

    @Override
    public String toString() {
        return source;
    }
}
