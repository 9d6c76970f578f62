package com.example.atlas.server.service;

import com.example.atlas.server.dto.DiskUsage;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PROPFIND multistatus 응답 본문에 RFC 4331 쿼터 속성을 주입합니다.
 * <p>
 * 본문을 네임스페이스 인식 DOM으로 파싱하여 문서 순서상 첫 번째 {@code DAV:prop} 요소를 찾고,
 * 마지막 자식으로 두 요소를 추가한 뒤 다시 직렬화합니다.
 * </p>
 * <pre>
 * &lt;D:prop&gt;
 *   ...
 *   &lt;D:quota-available-bytes&gt;1234&lt;/D:quota-available-bytes&gt;
 *   &lt;D:quota-used-bytes&gt;5678&lt;/D:quota-used-bytes&gt;
 * &lt;/D:prop&gt;
 * </pre>
 *
 * <h3>네임스페이스 접두어:</h3>
 * <p>
 * 클라이언트(특히 Windows 미니리다이렉터)는 접두어 불일치에 민감하므로, 본문 텍스트에서
 * {@code xmlns:X="DAV:"} 선언을 찾아 그 접두어 X를 그대로 사용합니다. 선언이 없으면 "D"를 사용합니다.
 * </p>
 */
@Slf4j
public class QuotaPropertyInjector {

    public static final String DAV_NAMESPACE = "DAV:";

    public static final String DEFAULT_PREFIX = "D";

    public static final String QUOTA_AVAILABLE_BYTES = "quota-available-bytes";

    public static final String QUOTA_USED_BYTES = "quota-used-bytes";

    private static final Pattern DAV_PREFIX_PATTERN =
            Pattern.compile("xmlns:([a-zA-Z0-9_]+)=\"DAV:\"");

    private final DocumentBuilderFactory documentBuilderFactory;
    private final TransformerFactory transformerFactory;

    public QuotaPropertyInjector() {
        this.documentBuilderFactory = DocumentBuilderFactory.newInstance();
        this.documentBuilderFactory.setNamespaceAware(true);
        this.documentBuilderFactory.setExpandEntityReferences(false);
        try {
            this.documentBuilderFactory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            this.documentBuilderFactory.setFeature(
                    "http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML 파서 보안 설정 실패", e);
        }
        this.transformerFactory = TransformerFactory.newInstance();
    }

    /**
     * 본문에서 DAV: 네임스페이스에 바인딩된 접두어를 찾습니다.
     *
     * @return 첫 번째 {@code xmlns:X="DAV:"} 선언의 X, 없으면 "D"
     */
    public String detectPrefix(String body) {
        Matcher matcher = DAV_PREFIX_PATTERN.matcher(body);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return DEFAULT_PREFIX;
    }

    /**
     * 쿼터 속성을 주입한 새 본문을 반환합니다.
     * 주입할 위치({@code DAV:prop})가 없거나 본문을 파싱할 수 없으면 원본 배열을 그대로 반환합니다.
     *
     * @param body  엔진이 작성한 multistatus 응답 본문
     * @param usage 보고할 여유/사용 바이트 수
     */
    public byte[] inject(byte[] body, DiskUsage usage) {
        // 접두어 탐지는 ASCII 범위만 보므로 ISO-8859-1로 읽어도 결과가 같음
        String prefix = detectPrefix(new String(body, StandardCharsets.ISO_8859_1));

        Document document;
        try {
            DocumentBuilder builder = documentBuilderFactory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            document = builder.parse(new ByteArrayInputStream(body));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            log.warn("=== [QUOTA] multistatus 본문 파싱 실패, 원본 유지: {} ===", e.getMessage());
            return body;
        }

        NodeList props = document.getElementsByTagNameNS(DAV_NAMESPACE, "prop");
        if (props.getLength() == 0) {
            log.debug("=== [QUOTA] DAV:prop 요소 없음, 원본 유지 ===");
            return body;
        }
        Element prop = (Element) props.item(0);

        boolean prefixBound = DAV_NAMESPACE.equals(prop.lookupNamespaceURI(prefix));
        prop.appendChild(createQuotaElement(document, prefix, prefixBound,
                QUOTA_AVAILABLE_BYTES, usage.getFreeBytes()));
        prop.appendChild(createQuotaElement(document, prefix, prefixBound,
                QUOTA_USED_BYTES, usage.getUsedBytes()));

        try {
            return serialize(document);
        } catch (TransformerException e) {
            log.warn("=== [QUOTA] multistatus 직렬화 실패, 원본 유지: {} ===", e.getMessage());
            return body;
        }
    }

    private Element createQuotaElement(Document document, String prefix, boolean prefixBound,
                                       String localName, long value) {
        Element element = document.createElementNS(DAV_NAMESPACE, prefix + ":" + localName);
        if (!prefixBound) {
            element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI,
                    XMLConstants.XMLNS_ATTRIBUTE + ":" + prefix, DAV_NAMESPACE);
        }
        element.setTextContent(Long.toString(value));
        return element;
    }

    private byte[] serialize(Document document) throws TransformerException {
        String encoding = document.getXmlEncoding() != null
                ? document.getXmlEncoding()
                : StandardCharsets.UTF_8.name();
        document.setXmlStandalone(true);

        Transformer transformer = transformerFactory.newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, encoding);
        transformer.setOutputProperty(OutputKeys.INDENT, "no");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        transformer.transform(new DOMSource(document), new StreamResult(out));
        return out.toByteArray();
    }
}
