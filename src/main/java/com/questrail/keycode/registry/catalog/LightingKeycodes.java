package com.questrail.keycode.registry.catalog;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;

import java.util.List;

/** Backlight, RGB underglow, RGB matrix and LED matrix controls. */
public final class LightingKeycodes
{
    public static final List<Keycode> BACKLIGHT = List.of(
            lighting("BL_TOGG", "BL\nToggle").withTooltip("Turn the backlight on or off").build(),
            lighting("BL_STEP", "BL\nCycle").withTooltip("Cycle through backlight levels").build(),
            lighting("BL_BRTG", "BL\nBreath").withTooltip("Toggle backlight breathing").build(),
            lighting("BL_ON", "BL On").withTooltip("Set the backlight to max brightness").build(),
            lighting("BL_OFF", "BL Off").withTooltip("Turn the backlight off").build(),
            lighting("BL_INC", "BL +").withTooltip("Increase the backlight level").build(),
            lighting("BL_DEC", "BL - ").withTooltip("Decrease the backlight level").build()
    );

    public static final List<Keycode> RGB = List.of(
            lighting("RGB_TOG", "RGB\nToggle").withTooltip("Toggle RGB lighting on or off").build(),
            lighting("RGB_MOD", "RGB\nMode +").withTooltip("Next RGB mode").build(),
            lighting("RGB_RMOD", "RGB\nMode -").withTooltip("Previous RGB mode").build(),
            lighting("RGB_HUI", "Hue +").withTooltip("Increase hue").build(),
            lighting("RGB_HUD", "Hue -").withTooltip("Decrease hue").build(),
            lighting("RGB_SAI", "Sat +").withTooltip("Increase saturation").build(),
            lighting("RGB_SAD", "Sat -").withTooltip("Decrease saturation").build(),
            lighting("RGB_VAI", "Bright +").withTooltip("Increase value").build(),
            lighting("RGB_VAD", "Bright -").withTooltip("Decrease value").build(),
            lighting("RGB_SPI", "Effect +").withTooltip("Increase RGB effect speed").build(),
            lighting("RGB_SPD", "Effect -").withTooltip("Decrease RGB effect speed").build(),
            lighting("RGB_M_P", "RGB\nMode P").withTooltip("RGB Mode: Plain").build(),
            lighting("RGB_M_B", "RGB\nMode B").withTooltip("RGB Mode: Breathe").build(),
            lighting("RGB_M_R", "RGB\nMode R").withTooltip("RGB Mode: Rainbow").build(),
            lighting("RGB_M_SW", "RGB\nMode SW").withTooltip("RGB Mode: Swirl").build(),
            lighting("RGB_M_SN", "RGB\nMode SN").withTooltip("RGB Mode: Snake").build(),
            lighting("RGB_M_K", "RGB\nMode K").withTooltip("RGB Mode: Knight Rider").build(),
            lighting("RGB_M_X", "RGB\nMode X").withTooltip("RGB Mode: Christmas").build(),
            lighting("RGB_M_G", "RGB\nMode G").withTooltip("RGB Mode: Gradient").build(),
            lighting("RGB_M_T", "RGB\nMode T").withTooltip("RGB Mode: Test").build()
    );

    public static final List<Keycode> RGB_MATRIX = List.of(
            lighting("RM_ON", "RGBM\nOn").withTooltip("Turn on RGB Matrix").build(),
            lighting("RM_OFF", "RGBM\nOff").withTooltip("Turn off RGB Matrix").build(),
            lighting("RM_TOGG", "RGBM\nTogg").withTooltip("Toggle RGB Matrix on or off").build(),
            lighting("RM_NEXT", "RGBM\nNext").withTooltip("Cycle through animations").build(),
            lighting("RM_PREV", "RGBM\nPrev").withTooltip("Cycle through animations in reverse").build(),
            lighting("RM_HUEU", "RGBM\nHue +").withTooltip("Cycle through hue").build(),
            lighting("RM_HUED", "RGBM\nHue -").withTooltip("Cycle through hue in reverse").build(),
            lighting("RM_SATU", "RGBM\nSat +").withTooltip("Increase the saturation").build(),
            lighting("RM_SATD", "RGBM\nSat -").withTooltip("Decrease the saturation").build(),
            lighting("RM_VALU", "RGBM\nBright +").withTooltip("Increase the brightness level").build(),
            lighting("RM_VALD", "RGBM\nBright -").withTooltip("Decrease the brightness level").build(),
            lighting("RM_SPDU", "RGBM\nSpeed +").withTooltip("Increase the animation speed").build(),
            lighting("RM_SPDD", "RGBM\nSpeed -").withTooltip("Decrease the animation speed").build()
    );

    public static final List<Keycode> LED_MATRIX = List.of(
            lighting("LM_ON", "LED\nOn").withTooltip("Turn on LED Matrix").build(),
            lighting("LM_OFF", "LED\nOff").withTooltip("Turn off LED Matrix").build(),
            lighting("LM_TOGG", "LED\nTogg").withTooltip("Toggle LED Matrix on or off").build(),
            lighting("LM_NEXT", "LED\nNext").withTooltip("Cycle through LED Matrix animations").build(),
            lighting("LM_PREV", "LED\nPrev").withTooltip("Cycle through LED Matrix animations in reverse").build(),
            lighting("LM_BRIU", "LED\nBright +").withTooltip("Increase LED Matrix brightness").build(),
            lighting("LM_BRID", "LED\nBright -").withTooltip("Decrease LED Matrix brightness").build(),
            lighting("LM_SPDU", "LED\nSpeed +").withTooltip("Increase LED Matrix animation speed").build(),
            lighting("LM_SPDD", "LED\nSpeed -").withTooltip("Decrease LED Matrix animation speed").build()
    );

    public static final List<Keycode> ALL = Catalogs.concat(BACKLIGHT, RGB, RGB_MATRIX, LED_MATRIX);

    private LightingKeycodes() {
    }

    private static Keycode.Builder lighting(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.LIGHTING);
    }
}
