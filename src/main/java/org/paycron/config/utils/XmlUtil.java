package org.paycron.config.utils;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.JAXBException;
import jakarta.xml.bind.Unmarshaller;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.file.Path;

public class XmlUtil {

    private XmlUtil() {}

    /**
     * Parse an XML file into a DOM document. External entities are disabled,
     * the configuration file holds credential paths.
     */
    public static Document parse(Path file) throws ParserConfigurationException, IOException, SAXException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        DocumentBuilder builder = factory.newDocumentBuilder();
        return builder.parse(file.toFile());
    }

    /**
     *  Convert XML → Java object.
     *  JAXBContext is created for the requested type, so any class with
     *  an @XmlRootElement works here.
     */
    @SuppressWarnings("unchecked")
    public static <T> T unmarshal(Document xmlDoc, Class<T> type) throws JAXBException {
        JAXBContext ctx = JAXBContext.newInstance(type);
        Unmarshaller um = ctx.createUnmarshaller();
        return (T) um.unmarshal(xmlDoc);
    }
}
