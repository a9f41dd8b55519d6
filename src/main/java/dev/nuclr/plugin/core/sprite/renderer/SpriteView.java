package dev.nuclr.plugin.core.sprite.renderer;

import lombok.extern.slf4j.Slf4j;

import javax.swing.JPanel;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.image.BufferedImage;

/**
 * Swing component that shows one sprite at the component's current size.
 *
 * <p>Must be used with a renderer owned by the EDT ({@link SpriteRenderer#forSwing});
 * the pixmap arrives asynchronously and the view repaints itself.
 */
@Slf4j
public class SpriteView extends JPanel {

    private final ViewClient client;

    public SpriteView(SpriteRenderer renderer, String spriteKey) {
        this.client = new ViewClient(renderer, spriteKey);
        setOpaque(false);
        addComponentListener(new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                updateRenderSize();
            }
        });
    }

    public SpriteRendererClient client() {
        return client;
    }

    public BufferedImage pixmap() {
        return client.pixmap();
    }

    /** Request the sprite at the component's current size. */
    public void updateRenderSize() {
        client.setRenderSize(new Dimension(getWidth(), getHeight()));
    }

    /** Stop receiving pixmaps. The view shows nothing afterwards. */
    public void dispose() {
        client.close();
    }

    @Override
    protected void paintComponent(Graphics g) {
        super.paintComponent(g);
        Graphics2D g2 = (Graphics2D) g.create();
        try {
            BufferedImage img = client.pixmap();
            if (img != null) {
                int x = (getWidth()  - img.getWidth())  / 2;
                int y = (getHeight() - img.getHeight()) / 2;
                g2.drawImage(img, x, y, null);
            } else if (!client.isValid()) {
                drawCenteredMessage(g2, "Missing sprite: " + client.spriteKey());
            }
        } finally {
            g2.dispose();
        }
    }

    private void drawCenteredMessage(Graphics2D g2, String msg) {
        g2.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g2.setColor(new Color(0x888888));
        g2.setFont(getFont().deriveFont(Font.PLAIN, 11f));
        FontMetrics fm = g2.getFontMetrics();
        int x = (getWidth()  - fm.stringWidth(msg)) / 2;
        int y = (getHeight() + fm.getAscent())        / 2;
        g2.drawString(msg, x, y);
    }

    private final class ViewClient extends SpriteRendererClient {

        ViewClient(SpriteRenderer renderer, String spriteKey) {
            super(renderer, spriteKey);
        }

        @Override
        protected void receivePixmap(BufferedImage pixmap) {
            log.debug("Sprite {} delivered at {}", spriteKey(), renderSize());
            repaint();
        }
    }
}
