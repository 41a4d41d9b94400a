package org.lanegraph.app;

import org.lanegraph.network.NetworkTopology;
import org.lanegraph.network.SumoNetReader;
import org.lanegraph.network.TopologyException;
import org.lanegraph.position.EdgeStart;
import org.lanegraph.position.GlobalPositionMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Inspection entry point: reads a {@code .net.xml} file and prints its global offset table.
 *
 * <pre>
 * Main &lt;net.xml&gt; [--no-internal-links]
 * </pre>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    /**
     * @param args network path, optionally followed by {@code --no-internal-links}.
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("usage: Main <net.xml> [--no-internal-links]");
            System.exit(2);
            return;
        }
        boolean noInternalLinks = args.length > 1 && "--no-internal-links".equals(args[1]);
        try {
            NetworkTopology topology = new SumoNetReader(noInternalLinks, NetworkTopology.DEFAULT_INTERNAL_MARKER)
                    .read(Path.of(args[0]));
            GlobalPositionMap positions = GlobalPositionMap.build(topology);
            System.out.println(topology);
            for (EdgeStart start : positions.offsetTable()) {
                System.out.printf(Locale.ROOT, "%12.3f  %s%n", start.offset(), start.edgeId());
            }
        } catch (TopologyException ex) {
            log.error("Cannot build network from {} ({})", args[0], ex.getReasonCode(), ex);
            System.exit(1);
        }
    }
}
