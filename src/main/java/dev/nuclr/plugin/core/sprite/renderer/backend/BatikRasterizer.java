package dev.nuclr.plugin.core.sprite.renderer.backend;

import lombok.extern.slf4j.Slf4j;
import org.apache.batik.anim.dom.SAXSVGDocumentFactory;
import org.apache.batik.bridge.BridgeContext;
import org.apache.batik.bridge.DocumentLoader;
import org.apache.batik.bridge.GVTBuilder;
import org.apache.batik.bridge.UserAgent;
import org.apache.batik.bridge.UserAgentAdapter;
import org.apache.batik.gvt.GraphicsNode;
import org.apache.batik.util.XMLResourceDescriptor;
import org.w3c.dom.Element;
import org.w3c.dom.svg.SVGDocument;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;
import java.nio.file.Path;

/**
 * SVG rasterizer backed by Apache Batik.
 * The document is parsed and its GVT tree built once, on construction.
 */
@Slf4j
public class BatikRasterizer implements SpriteRasterizer {

    private final Path source;

    private SVGDocument document;
    private BridgeContext context;

    public BatikRasterizer(Path source) {
        this.source = source;
        try {
            SAXSVGDocumentFactory factory =
                    new SAXSVGDocumentFactory(XMLResourceDescriptor.getXMLParserClassName());
            SVGDocument doc = factory.createSVGDocument(source.toUri().toString());

            UserAgent agent = new UserAgentAdapter();
            BridgeContext ctx = new BridgeContext(agent, new DocumentLoader(agent));
            // keeps the element -> graphics node mapping
            ctx.setDynamicState(BridgeContext.DYNAMIC);
            new GVTBuilder().build(ctx, doc);

            document = doc;
            context = ctx;
            log.debug("Batik: loaded {}", source);
        } catch (Exception e) {
            log.warn("Batik: cannot load SVG {}: {}", source, e.getMessage());
            document = null;
            context = null;
        }
    }

    @Override
    public String name() {
        return "Batik:" + source.getFileName();
    }

    @Override
    public boolean isValid() {
        return document != null;
    }

    @Override
    public boolean elementExists(String elementId) {
        return document != null && document.getElementById(elementId) != null;
    }

    @Override
    public Rectangle2D boundsOnElement(String elementId) {
        GraphicsNode node = nodeFor(elementId);
        if (node == null) return new Rectangle2D.Double();
        Rectangle2D bounds = node.getTransformedBounds(parentTransform(node));
        return bounds != null ? bounds : new Rectangle2D.Double();
    }

    @Override
    public void render(Graphics2D g, String elementId, Rectangle2D target) {
        GraphicsNode node = nodeFor(elementId);
        if (node == null) return;
        AffineTransform parentTx = parentTransform(node);
        Rectangle2D bounds = node.getTransformedBounds(parentTx);
        if (bounds == null || bounds.isEmpty()) return;

        Graphics2D g2 = (Graphics2D) g.create();
        try {
            g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2.translate(target.getX(), target.getY());
            g2.scale(target.getWidth() / bounds.getWidth(), target.getHeight() / bounds.getHeight());
            g2.translate(-bounds.getX(), -bounds.getY());
            g2.transform(parentTx);
            node.paint(g2);
        } finally {
            g2.dispose();
        }
    }

    @Override
    public void close() {
        if (context != null) {
            try {
                context.dispose();
            } catch (Exception e) {
                log.warn("Error disposing Batik bridge context", e);
            }
            context = null;
        }
        document = null;
    }

    // ---------------------------------------------------------------- helpers

    private GraphicsNode nodeFor(String elementId) {
        if (document == null || context == null) return null;
        Element element = document.getElementById(elementId);
        return element != null ? context.getGraphicsNode(element) : null;
    }

    /** Node transforms are applied by {@link GraphicsNode#paint}, so only the ancestors' are needed. */
    private static AffineTransform parentTransform(GraphicsNode node) {
        GraphicsNode parent = node.getParent();
        AffineTransform tx = parent != null ? parent.getGlobalTransform() : null;
        return tx != null ? tx : new AffineTransform();
    }
}
