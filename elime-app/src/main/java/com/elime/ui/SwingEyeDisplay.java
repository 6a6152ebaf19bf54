package com.elime.ui;

import com.elime.model.Rectangle;
import com.elime.service.correction.CoarseState;
import com.elime.service.correction.EyeDisplay;
import com.elime.service.correction.FineState;
import com.elime.service.correction.InputEvent;
import com.elime.service.correction.InputEvent.Button;
import com.elime.service.correction.Key;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JFrame;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.awt.image.BufferedImage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Swing windows for the correction sessions. Each title gets its own frame
 * and its own event queue; the calling thread blocks on that queue while the
 * event dispatch thread fills it.
 */
public class SwingEyeDisplay implements EyeDisplay {

    private static final Logger log = LoggerFactory.getLogger(SwingEyeDisplay.class);

    private final OverlayPainter painter;
    private final Map<String, Window> windows = new LinkedHashMap<>();

    public SwingEyeDisplay(OverlayPainter painter) {
        this.painter = painter;
    }

    @Override
    public void showCoarse(String title, BufferedImage image, CoarseState state) {
        window(title).show(painter.paintCoarse(image, state));
    }

    @Override
    public void showFine(String title, BufferedImage nativeImage, FineState state) {
        window(title).show(painter.paintFine(nativeImage, state));
    }

    @Override
    public void showDetection(String title, BufferedImage image, List<Rectangle> faces, Rectangle biggestFace,
                              List<Rectangle> eyes) {
        window(title).show(painter.paintDetection(image, faces, biggestFace, eyes));
    }

    @Override
    public void showFrame(String title, BufferedImage frame) {
        window(title).show(frame);
    }

    @Override
    public InputEvent nextEvent(String title) {
        try {
            return window(title).events.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for input in {}, quitting", title);
            return InputEvent.key(Key.QUIT);
        }
    }

    @Override
    public void close(String title) {
        Window window = windows.remove(title);
        if (window != null) {
            SwingUtilities.invokeLater(window::dispose);
        }
    }

    @Override
    public void close() {
        List.copyOf(windows.keySet()).forEach(this::close);
    }

    private Window window(String title) {
        return windows.computeIfAbsent(title, t -> {
            Window window = new Window(t);
            SwingUtilities.invokeLater(window::open);
            return window;
        });
    }

    private static final class Window {

        private final String title;
        private final BlockingQueue<InputEvent> events = new LinkedBlockingQueue<>();
        private JFrame frame;
        private ImagePanel panel;

        Window(String title) {
            this.title = title;
        }

        void open() {
            frame = new JFrame(title);
            frame.setDefaultCloseOperation(JFrame.DO_NOTHING_ON_CLOSE);
            frame.setFocusTraversalKeysEnabled(false);
            panel = new ImagePanel();
            frame.add(panel);

            frame.addKeyListener(new KeyAdapter() {
                @Override
                public void keyPressed(KeyEvent e) {
                    events.add(InputEvent.key(KeyBindings.keyFor(e.getKeyCode(), e.getKeyChar())));
                }
            });
            MouseAdapter mouse = new MouseAdapter() {
                @Override
                public void mousePressed(MouseEvent e) {
                    events.add(InputEvent.pointerDown(e.getX(), e.getY(), button(e)));
                }

                @Override
                public void mouseDragged(MouseEvent e) {
                    events.add(InputEvent.pointerMove(e.getX(), e.getY()));
                }

                @Override
                public void mouseReleased(MouseEvent e) {
                    events.add(InputEvent.pointerUp(e.getX(), e.getY(), button(e)));
                }
            };
            panel.addMouseListener(mouse);
            panel.addMouseMotionListener(mouse);
            frame.addWindowListener(new WindowAdapter() {
                @Override
                public void windowClosing(WindowEvent e) {
                    events.add(InputEvent.key(Key.QUIT));
                }
            });

            frame.pack();
            frame.setLocationByPlatform(true);
            frame.setVisible(true);
        }

        void show(BufferedImage image) {
            SwingUtilities.invokeLater(() -> {
                panel.setImage(image);
                frame.pack();
                frame.toFront();
                frame.requestFocus();
            });
        }

        void dispose() {
            if (frame != null) {
                frame.dispose();
            }
        }

        private static Button button(MouseEvent e) {
            return SwingUtilities.isRightMouseButton(e) ? Button.SECONDARY : Button.PRIMARY;
        }
    }

    private static final class ImagePanel extends JPanel {

        private BufferedImage image;

        void setImage(BufferedImage image) {
            this.image = image;
            setPreferredSize(new Dimension(image.getWidth(), image.getHeight()));
            repaint();
        }

        @Override
        protected void paintComponent(Graphics g) {
            super.paintComponent(g);
            if (image != null) {
                g.drawImage(image, 0, 0, null);
            }
        }
    }
}
