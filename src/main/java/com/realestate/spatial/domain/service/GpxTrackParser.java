package com.realestate.spatial.domain.service;

import com.realestate.spatial.domain.exception.TrackParseException;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.TrackParseResult;
import org.locationtech.jts.geom.LineString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads GPX 1.0/1.1 files into a WGS84 polyline.
 * Track points are preferred, then route points, then waypoints.
 */
@Service
public class GpxTrackParser {

    private static final Logger logger = LoggerFactory.getLogger(GpxTrackParser.class);
    private static final String[] POINT_TAGS = {"trkpt", "rtept", "wpt"};

    private final GeometryTextCodec geometryTextCodec;

    public GpxTrackParser(GeometryTextCodec geometryTextCodec) {
        this.geometryTextCodec = geometryTextCodec;
    }

    public TrackParseResult parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new TrackParseException(TrackParseException.Reason.UNRECOGNIZED_FORMAT, "Track file is empty");
        }

        Document document = readDocument(content);
        Element root = document.getDocumentElement();
        if (!"gpx".equalsIgnoreCase(localName(root))) {
            throw new TrackParseException(TrackParseException.Reason.UNRECOGNIZED_FORMAT,
                    "Not a GPX file: root element is <" + localName(root) + ">");
        }

        List<Coordinate> points = List.of();
        for (String tag : POINT_TAGS) {
            points = readPoints(document, tag);
            if (!points.isEmpty()) {
                logger.debug("Read {} <{}> points from GPX", points.size(), tag);
                break;
            }
        }

        if (points.size() < 2) {
            throw new TrackParseException(TrackParseException.Reason.EMPTY_TRACK,
                    "Track must contain at least 2 valid points, found " + points.size());
        }

        LineString line = geometryTextCodec.lineString(points);
        return new TrackParseResult(line, points.get(0), points.get(points.size() - 1), points.size());
    }

    private Document readDocument(byte[] content) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            // fatal errors still throw, nothing is printed to stderr
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new ByteArrayInputStream(content));
        } catch (SAXException | IOException e) {
            throw new TrackParseException(TrackParseException.Reason.UNRECOGNIZED_FORMAT,
                    "Could not read track file as XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser misconfigured", e);
        }
    }

    private List<Coordinate> readPoints(Document document, String tag) {
        NodeList nodes = document.getElementsByTagNameNS("*", tag);
        List<Coordinate> points = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Element element = (Element) nodes.item(i);
            Double lat = parseDouble(element.getAttribute("lat"));
            Double lon = parseDouble(element.getAttribute("lon"));
            if (lat == null || lon == null || !Coordinate.isValid(lat, lon)) {
                logger.debug("Skipping <{}> with unusable coordinates lat='{}' lon='{}'",
                        tag, element.getAttribute("lat"), element.getAttribute("lon"));
                continue;
            }
            points.add(new Coordinate(lat, lon));
        }
        return points;
    }

    private static Double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }
}
