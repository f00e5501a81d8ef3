package fr.lapetina.configgraph;

import fr.lapetina.configgraph.domain.exception.ConfigGraphException;
import fr.lapetina.configgraph.domain.graph.InstanceGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: resolves the named sections of a root
 * configuration file and prints them.
 *
 * <pre>
 * config-graph app.ini service database [--metrics]
 * </pre>
 *
 * Without section names, every section of the merged store is resolved.
 */
public class ConfigGraphApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigGraphApplication.class);

    private final ResolverFactory factory;

    public ConfigGraphApplication(String configPath) {
        log.info("Starting config-graph...");
        this.factory = ResolverFactory.create(configPath).start();
    }

    /**
     * Resolves each section and prints {@code name = instance}.
     *
     * @return the number of sections that failed to resolve
     */
    public int run(List<String> sections, PrintStream out) {
        factory.closeRetired();
        InstanceGraphBuilder builder = factory.getBuilder();
        List<String> names = sections.isEmpty()
                ? new ArrayList<>(builder.getStore().getSectionNames())
                : sections;
        int failures = 0;
        for (String name : names) {
            try {
                out.println(name + " = " + builder.resolve(name));
            } catch (ConfigGraphException e) {
                failures++;
                log.error("Failed to resolve '{}' ({}): {}", name, e.getErrorType(), e.getMessage());
            }
        }
        return failures;
    }

    public ResolverFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down config-graph...");

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: config-graph <root-config> [section ...] [--metrics]");
            System.exit(2);
        }
        List<String> sections = new ArrayList<>();
        boolean metrics = false;
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--metrics")) {
                metrics = true;
            } else {
                sections.add(args[i]);
            }
        }

        try {
            ConfigGraphApplication app = new ConfigGraphApplication(args[0]);
            Runtime.getRuntime().addShutdownHook(new Thread(app::close));

            int failures = app.run(sections, System.out);
            if (metrics) {
                System.out.print(app.getFactory().getMetrics().scrape());
            }
            System.exit(failures > 0 ? 1 : 0);

        } catch (RuntimeException e) {
            log.error("Failed to start config-graph", e);
            System.exit(1);
        }
    }
}
