package com.articlegate.core.feed;

import com.articlegate.core.model.FeedItem;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * RSS 2.0 / RSS 1.0(RDF) / Atom 최소 파서.
 * - 태그는 네임스페이스 접두어를 뗀 local name 으로, 대소문자 무시 비교
 * - RSS: channel 아래 item, RDF: 루트 바로 아래 item, Atom: 루트 아래 entry
 * - link 없는 항목은 버린다
 * - XML 이 깨졌으면 예외 대신 FeedParseException
 */
public final class FeedParser {

    /** 파싱 불가 문서 */
    public static final class FeedParseException extends Exception {
        public FeedParseException(String message, Throwable cause) { super(message, cause); }
    }

    public enum FeedKind { RSS, RDF, ATOM, UNKNOWN }

    public List<FeedItem> parse(byte[] xml) throws FeedParseException {
        return parse(new InputSource(new ByteArrayInputStream(xml == null ? new byte[0] : xml)));
    }

    public List<FeedItem> parse(String xml) throws FeedParseException {
        return parse(new InputSource(new StringReader(xml == null ? "" : xml)));
    }

    private List<FeedItem> parse(InputSource src) throws FeedParseException {
        Document doc;
        try {
            DocumentBuilder b = newBuilder();
            doc = b.parse(src);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new FeedParseException("malformed feed xml: " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        if (root == null) return List.of();

        switch (kindOf(root)) {
            case RSS: {
                Element channel = firstChild(root, "channel");
                return channel == null ? List.of() : rssItems(channel);
            }
            case RDF:
                return rssItems(root);
            case ATOM:
                return atomEntries(root);
            default:
                return List.of();
        }
    }

    static FeedKind kindOf(Element root) {
        switch (name(root)) {
            case "rss": return FeedKind.RSS;
            case "rdf": return FeedKind.RDF;
            case "feed": return FeedKind.ATOM;
            default: return FeedKind.UNKNOWN;
        }
    }

    private static List<FeedItem> rssItems(Element parent) {
        List<FeedItem> out = new ArrayList<>();
        for (Element it : children(parent, "item")) {
            String link = text(firstChild(it, "link"));
            if (link.isEmpty()) continue;
            String published = text(firstChild(it, "pubDate"));
            if (published.isEmpty()) published = text(firstChild(it, "date")); // dc:date
            out.add(new FeedItem(
                    text(firstChild(it, "title")),
                    link,
                    text(firstChild(it, "description")),
                    published));
        }
        return out;
    }

    private static List<FeedItem> atomEntries(Element root) {
        List<FeedItem> out = new ArrayList<>();
        for (Element entry : children(root, "entry")) {
            String link = "";
            // <link href="..."/> 우선, 없으면 <link>...</link>
            for (Element l : children(entry, "link")) {
                String href = l.getAttribute("href").trim();
                if (!href.isEmpty()) { link = href; break; }
                String t = text(l);
                if (!t.isEmpty()) { link = t; break; }
            }
            if (link.isEmpty()) continue;

            String summary = text(firstChild(entry, "summary"));
            if (summary.isEmpty()) summary = text(firstChild(entry, "content"));
            String published = text(firstChild(entry, "updated"));
            if (published.isEmpty()) published = text(firstChild(entry, "published"));

            out.add(new FeedItem(text(firstChild(entry, "title")), link, summary, published));
        }
        return out;
    }

    // ---------- DOM helpers ----------

    /** 네임스페이스 접두어 제거 + 소문자 */
    static String name(Node n) {
        String local = n.getLocalName();
        String s = (local != null) ? local : n.getNodeName();
        int colon = s.indexOf(':');
        if (colon >= 0) s = s.substring(colon + 1);
        return s.toLowerCase(Locale.ROOT);
    }

    private static List<Element> children(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        String want = localName.toLowerCase(Locale.ROOT);
        NodeList nl = parent.getChildNodes();
        for (int i = 0; i < nl.getLength(); i++) {
            Node n = nl.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && name(n).equals(want)) out.add((Element) n);
        }
        return out;
    }

    private static Element firstChild(Element parent, String localName) {
        List<Element> c = children(parent, localName);
        return c.isEmpty() ? null : c.get(0);
    }

    private static String text(Element e) {
        if (e == null) return "";
        String t = e.getTextContent();
        return t == null ? "" : t.strip();
    }

    /** XXE 차단: 외부 엔티티/외부 DTD 로딩 금지, secure processing */
    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        f.setFeature("http://xml.org/sax/features/external-general-entities", false);
        f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        f.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        f.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        f.setXIncludeAware(false);
        f.setExpandEntityReferences(false);
        DocumentBuilder b = f.newDocumentBuilder();
        // 기본 핸들러는 stderr 에 [Fatal Error] 를 찍으므로 조용한 핸들러로 교체 (예외는 그대로 던져진다)
        b.setErrorHandler(new DefaultHandler() {
            @Override
            public void fatalError(SAXParseException e) throws SAXException { throw e; }
        });
        return b;
    }
}
