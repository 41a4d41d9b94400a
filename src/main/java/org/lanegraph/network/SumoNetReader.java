package org.lanegraph.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming reader for SUMO {@code .net.xml} files.
 * <p>
 * Collects {@code <type>}, {@code <edge>}/{@code <lane>} and {@code <connection>} elements
 * into a {@link NetworkTopology}. Everything else (junction shapes, traffic-light logic,
 * roundabouts) is skipped.
 * </p>
 * <ul>
 * <li>Lane count is the number of {@code <lane>} children; length comes from the first lane.</li>
 * <li>Speed resolution order: edge attribute, edge type, first lane, {@link NetworkTopology#DEFAULT_SPEED_LIMIT}.</li>
 * <li>A connection leaving a non-internal edge through a {@code via} lane points at that
 * internal lane unless the network was built without internal links.</li>
 * </ul>
 */
public final class SumoNetReader {
    private static final Logger log = LoggerFactory.getLogger(SumoNetReader.class);

    public static final String REASON_NET_FILE_UNREADABLE = "T10_NET_FILE_UNREADABLE";
    public static final String REASON_MALFORMED_NET_FILE = "T11_MALFORMED_NET_FILE";

    private final boolean noInternalLinks;
    private final String internalMarker;

    /**
     * Creates a reader for networks generated with internal links.
     */
    public SumoNetReader() {
        this(false, NetworkTopology.DEFAULT_INTERNAL_MARKER);
    }

    /**
     * @param noInternalLinks true when the network was generated with {@code no-internal-links}.
     * @param internalMarker id prefix of junction-internal edges.
     */
    public SumoNetReader(boolean noInternalLinks, String internalMarker) {
        this.noInternalLinks = noInternalLinks;
        this.internalMarker = Objects.requireNonNull(internalMarker, "internalMarker");
    }

    public NetworkTopology read(Path netFile) {
        Objects.requireNonNull(netFile, "netFile");
        try (InputStream in = Files.newInputStream(netFile)) {
            log.info("Reading network file {}", netFile);
            return read(in);
        } catch (IOException ex) {
            throw new TopologyException(REASON_NET_FILE_UNREADABLE, "cannot read " + netFile, ex);
        }
    }

    public NetworkTopology read(InputStream in) {
        Objects.requireNonNull(in, "in");
        XMLInputFactory factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        XMLStreamReader sReader = null;
        try {
            sReader = factory.createXMLStreamReader(in, "UTF-8");
            return parse(sReader);
        } catch (XMLStreamException ex) {
            throw new TopologyException(REASON_MALFORMED_NET_FILE, "invalid network XML: " + ex.getMessage(), ex);
        } finally {
            closeQuietly(sReader);
        }
    }

    private NetworkTopology parse(XMLStreamReader sReader) throws XMLStreamException {
        Map<String, Double> typeSpeeds = new HashMap<>();
        NetworkTopology.Builder builder = NetworkTopology.builder().internalMarker(internalMarker);
        PendingEdge pending = null;
        int connectionCount = 0;

        for (int event = sReader.getEventType(); event != XMLStreamConstants.END_DOCUMENT; event = sReader.next()) {
            if (event == XMLStreamConstants.START_ELEMENT) {
                switch (sReader.getLocalName()) {
                    case "type" -> {
                        String speed = sReader.getAttributeValue(null, "speed");
                        if (speed != null) {
                            typeSpeeds.put(requireAttribute(sReader, "id"), parseDouble(speed, "type speed"));
                        }
                    }
                    case "edge" -> {
                        pending = new PendingEdge(requireAttribute(sReader, "id"));
                        String speed = sReader.getAttributeValue(null, "speed");
                        if (speed != null) {
                            pending.speed = parseDouble(speed, "edge speed");
                        } else {
                            String type = sReader.getAttributeValue(null, "type");
                            if (type != null && typeSpeeds.containsKey(type)) {
                                pending.speed = typeSpeeds.get(type);
                            }
                        }
                    }
                    case "lane" -> {
                        if (pending != null) {
                            if (pending.lanes == 0) {
                                pending.length = parseDouble(requireAttribute(sReader, "length"), "lane length");
                                String laneSpeed = sReader.getAttributeValue(null, "speed");
                                if (pending.speed == null && laneSpeed != null) {
                                    pending.speed = parseDouble(laneSpeed, "lane speed");
                                }
                            }
                            pending.lanes++;
                        }
                    }
                    case "connection" -> {
                        builder.connection(toConnection(sReader));
                        connectionCount++;
                    }
                    default -> {
                        // not part of the topology
                    }
                }
            } else if (event == XMLStreamConstants.END_ELEMENT && "edge".equals(sReader.getLocalName())) {
                if (pending != null) {
                    builder.edge(
                            pending.id,
                            pending.length,
                            pending.lanes,
                            pending.speed == null ? NetworkTopology.DEFAULT_SPEED_LIMIT : pending.speed
                    );
                    pending = null;
                }
            }
        }
        log.debug("Parsed {} connection element(s)", connectionCount);
        return builder.build();
    }

    private Connection toConnection(XMLStreamReader sReader) {
        String fromEdge = requireAttribute(sReader, "from");
        int fromLane = parseInt(requireAttribute(sReader, "fromLane"), "fromLane");
        String via = sReader.getAttributeValue(null, "via");

        if (!fromEdge.startsWith(internalMarker) && !noInternalLinks && via != null) {
            // "via" names the internal lane, e.g. ":center_0_1" -> (":center_0", 1)
            int cut = via.lastIndexOf('_');
            if (cut <= 0) {
                throw new TopologyException(REASON_MALFORMED_NET_FILE, "cannot split via lane id: " + via);
            }
            return new Connection(fromEdge, fromLane, via.substring(0, cut),
                    parseInt(via.substring(cut + 1), "via lane index"));
        }
        return new Connection(
                fromEdge,
                fromLane,
                requireAttribute(sReader, "to"),
                parseInt(requireAttribute(sReader, "toLane"), "toLane")
        );
    }

    private static String requireAttribute(XMLStreamReader sReader, String name) {
        String value = sReader.getAttributeValue(null, name);
        if (value == null) {
            throw new TopologyException(REASON_MALFORMED_NET_FILE,
                    "<" + sReader.getLocalName() + "> missing attribute '" + name + "' at line "
                            + sReader.getLocation().getLineNumber());
        }
        return value;
    }

    private static double parseDouble(String raw, String what) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new TopologyException(REASON_MALFORMED_NET_FILE, what + " is not a number: " + raw, ex);
        }
    }

    private static int parseInt(String raw, String what) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new TopologyException(REASON_MALFORMED_NET_FILE, what + " is not an integer: " + raw, ex);
        }
    }

    private static void closeQuietly(XMLStreamReader sReader) {
        if (sReader == null) {
            return;
        }
        try {
            sReader.close();
        } catch (XMLStreamException ex) {
            log.warn("Failed to close XML reader", ex);
        }
    }

    private static final class PendingEdge {
        private final String id;
        private Double speed;
        private double length;
        private int lanes;

        private PendingEdge(String id) {
            this.id = id;
        }
    }
}
