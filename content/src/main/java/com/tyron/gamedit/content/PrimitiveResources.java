package com.tyron.gamedit.content;

import java.util.ArrayList;
import java.util.List;

/**
 * The materials and drawables every workspace has without any user interaction.
 * <p>
 * The ids are fixed; the engine's loader creates the same objects from them.
 */
public final class PrimitiveResources {

    /**
     * Always-available fallback material, e.g. for references to a deleted material.
     */
    public static final String CHECKERBOARD = "_checkerboard";

    public static final List<String> COLORS = List.of(
            "White", "Black", "Red", "DarkRed", "Green", "DarkGreen", "Blue", "DarkBlue",
            "Cyan", "DarkCyan", "Magenta", "DarkMagenta", "Yellow", "DarkYellow",
            "Gray", "DarkGray", "LightGray", "HotPink", "Gold", "Silver", "Bronze");

    private static final String[][] DRAWABLES = {
            {"_capsule", "2D Capsule", "Capsule"},
            {"_rect", "2D Rectangle", "Rectangle"},
            {"_isosceles_triangle", "2D Isosceles Triangle", "IsoscelesTriangle"},
            {"_right_triangle", "2D Right Triangle", "RightTriangle"},
            {"_circle", "2D Circle", "Circle"},
            {"_semi_circle", "2D Semi Circle", "SemiCircle"},
            {"_trapezoid", "2D Trapezoid", "Trapezoid"},
            {"_parallelogram", "2D Parallelogram", "Parallelogram"},
            {"_round_rect", "2D Round Rectangle", "RoundRectangle"},
            {"_arrow_cursor", "2D Arrow Cursor", "ArrowCursor"},
            {"_block_cursor", "2D Block Cursor", "BlockCursor"},
            {"_cone", "3D Cone", "Cone"},
            {"_cube", "3D Cube", "Cube"},
            {"_cylinder", "3D Cylinder", "Cylinder"},
            {"_pyramid", "3D Pyramid", "Pyramid"},
            {"_sphere", "3D Sphere", "Sphere"},
    };

    private PrimitiveResources() {
    }

    /**
     * @return fresh primitive instances, checkerboard first, then colors, then drawables.
     */
    public static List<ContentResource> create() {
        List<ContentResource> out = new ArrayList<>(1 + COLORS.size() + DRAWABLES.length);

        MaterialResource checkerboard = new MaterialResource(CHECKERBOARD, "Checkerboard",
                MaterialResource.MaterialType.TEXTURE);
        // bundled with the editor, not a workspace file
        checkerboard.addTexture("app://textures/Checkerboard.png");
        out.add(checkerboard);

        for (String color : COLORS) {
            MaterialResource material = new MaterialResource(colorId(color), color, MaterialResource.MaterialType.COLOR);
            material.setBaseColor(color);
            out.add(material);
        }

        for (String[] drawable : DRAWABLES) {
            out.add(new DrawableResource(drawable[0], drawable[1], drawable[2]));
        }

        for (ContentResource resource : out) {
            resource.setPrimitive(true);
        }
        return out;
    }

    public static String colorId(String color) {
        return "_" + color;
    }
}
