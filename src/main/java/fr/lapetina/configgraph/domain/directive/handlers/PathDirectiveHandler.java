package fr.lapetina.configgraph.domain.directive.handlers;

import fr.lapetina.configgraph.domain.directive.Directive;
import fr.lapetina.configgraph.domain.directive.DirectiveContext;
import fr.lapetina.configgraph.domain.directive.DirectiveHandler;

import java.nio.file.Path;

/**
 * {@code path:<payload>} - a {@link Path}, with a leading {@code ~} expanded
 * to the user's home directory.
 */
public final class PathDirectiveHandler implements DirectiveHandler {

    @Override
    public String getName() {
        return "path";
    }

    @Override
    public Object handle(Directive directive, DirectiveContext context) {
        return expand(directive.payload());
    }

    public static Path expand(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }
}
