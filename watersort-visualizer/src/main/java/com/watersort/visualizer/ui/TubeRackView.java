package com.watersort.visualizer.ui;

import com.watersort.core.ColorPalette;
import com.watersort.core.Move;
import com.watersort.core.PuzzleState;
import com.watersort.core.Tube;
import com.watersort.visualizer.model.PuzzleFrame;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import javafx.geometry.Insets;
import javafx.scene.Group;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.paint.Paint;
import javafx.scene.shape.Rectangle;
import javafx.scene.text.Text;

/**
 * Draws the tubes of a puzzle frame side by side, bottom unit at the bottom.
 */
public final class TubeRackView extends Pane {

    private static final double TUBE_WIDTH = 52.0;
    private static final double UNIT_HEIGHT = 34.0;
    private static final double TUBE_GAP = 26.0;
    private static final double LABEL_HEIGHT = 22.0;
    private static final double OUTLINE_WIDTH = 2.0;
    private static final Paint TUBE_FILL = Color.rgb(245, 247, 252);
    private static final Paint TUBE_STROKE = Color.rgb(120, 128, 145);
    private static final Paint SOURCE_STROKE = Color.web("#B71C1C");
    private static final Paint TARGET_STROKE = Color.web("#2E7D32");
    private static final Paint LABEL_FILL = Color.web("#4a4f64");

    private final Group rack = new Group();
    private final Map<String, Paint> paints = new HashMap<>();
    private double contentWidth;
    private double contentHeight;

    public TubeRackView() {
        setPadding(new Insets(16));
        setStyle("-fx-background-color: linear-gradient(to bottom, #fdfdfd, #e7ebf5);");
        getChildren().add(rack);
        setMinSize(0, 0);
        setMaxSize(Double.MAX_VALUE, Double.MAX_VALUE);
    }

    public void update(PuzzleFrame frame) {
        rack.getChildren().clear();
        if (frame == null) {
            contentWidth = 0;
            contentHeight = 0;
            requestLayout();
            return;
        }

        PuzzleState state = frame.state();
        Move move = frame.lastMove();
        double tubeHeight = state.capacity() * UNIT_HEIGHT;
        for (int i = 0; i < state.tubeCount(); i++) {
            double x = i * (TUBE_WIDTH + TUBE_GAP);
            Rectangle outline = new Rectangle(x, 0, TUBE_WIDTH, tubeHeight);
            outline.setArcWidth(12);
            outline.setArcHeight(12);
            outline.setFill(TUBE_FILL);
            outline.setStroke(strokeFor(i, move));
            outline.setStrokeWidth(move != null && (move.from() == i || move.to() == i) ? OUTLINE_WIDTH * 2 : OUTLINE_WIDTH);
            rack.getChildren().add(outline);

            Tube tube = state.tube(i);
            for (int unit = 0; unit < tube.size(); unit++) {
                double y = tubeHeight - (unit + 1) * UNIT_HEIGHT;
                Rectangle cell = new Rectangle(x + 4, y + 2, TUBE_WIDTH - 8, UNIT_HEIGHT - 4);
                cell.setArcWidth(6);
                cell.setArcHeight(6);
                cell.setFill(paintFor(frame.palette(), tube.colorAt(unit)));
                rack.getChildren().add(cell);
            }

            Text label = new Text(x + TUBE_WIDTH / 2.0 - 4, tubeHeight + LABEL_HEIGHT, Integer.toString(i));
            label.setFill(LABEL_FILL);
            rack.getChildren().add(label);
        }

        contentWidth = state.tubeCount() * (TUBE_WIDTH + TUBE_GAP) - TUBE_GAP;
        contentHeight = tubeHeight + LABEL_HEIGHT;
        setPrefSize(contentWidth + 64, contentHeight + 64);
        requestLayout();
    }

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        var insets = getInsets();
        double availableWidth = getWidth() - insets.getLeft() - insets.getRight();
        double availableHeight = getHeight() - insets.getTop() - insets.getBottom();
        double offsetX = insets.getLeft() + (availableWidth - contentWidth) / 2.0;
        double offsetY = insets.getTop() + (availableHeight - contentHeight) / 2.0;
        rack.relocate(offsetX, offsetY);
    }

    private static Paint strokeFor(int index, Move move) {
        if (move == null) {
            return TUBE_STROKE;
        }
        if (move.from() == index) {
            return SOURCE_STROKE;
        }
        return move.to() == index ? TARGET_STROKE : TUBE_STROKE;
    }

    private Paint paintFor(ColorPalette palette, int colorId) {
        String name = palette.nameOf(colorId);
        return paints.computeIfAbsent(name, TubeRackView::parseColor);
    }

    // Names that are not CSS colors get a stable hue derived from the name.
    private static Paint parseColor(String name) {
        try {
            return Color.web(name.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            double hue = Math.floorMod(name.hashCode(), 360);
            return Color.hsb(hue, 0.65, 0.85);
        }
    }
}
