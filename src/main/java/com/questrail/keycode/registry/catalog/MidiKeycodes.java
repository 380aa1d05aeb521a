package com.questrail.keycode.registry.catalog;

import com.questrail.keycode.api.Keycode;
import com.questrail.keycode.api.KeycodeCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * MIDI keycodes.
 *
 * <p>{@link #BASIC} holds the notes over six octaves plus all-notes-off.
 * {@link #ADVANCED} adds octave, transposition, velocity, channel and
 * controller keys and the step sequencer. Which of the two a device gets
 * depends on its MIDI level.</p>
 */
public final class MidiKeycodes
{
    private static final String[] NOTES = { "C", "Cs", "D", "Ds", "E", "F", "Fs", "G", "Gs", "A", "As", "B" };

    public static final List<Keycode> BASIC = basic();

    public static final List<Keycode> OCTAVE = List.of(
            midi("MI_OCT_N2", "MI\nOct-2").withTooltip("Midi set octave to -2").build(),
            midi("MI_OCT_N1", "MI\nOct-1").withTooltip("Midi set octave to -1").build(),
            midi("MI_OCT_0", "MI\nOct0").withTooltip("Midi set octave to 0").build(),
            midi("MI_OCT_1", "MI\nOct+1").withTooltip("Midi set octave to 1").build(),
            midi("MI_OCT_2", "MI\nOct+2").withTooltip("Midi set octave to 2").build(),
            midi("MI_OCT_3", "MI\nOct+3").withTooltip("Midi set octave to 3").build(),
            midi("MI_OCT_4", "MI\nOct+4").withTooltip("Midi set octave to 4").build(),
            midi("MI_OCT_5", "MI\nOct+5").withTooltip("Midi set octave to 5").build(),
            midi("MI_OCT_6", "MI\nOct+6").withTooltip("Midi set octave to 6").build(),
            midi("MI_OCT_7", "MI\nOct+7").withTooltip("Midi set octave to 7").build(),
            midi("MI_OCTD", "MI\nOctDN").withTooltip("Midi move down an octave").build(),
            midi("MI_OCTU", "MI\nOctUP").withTooltip("Midi move up an octave").build()
    );

    public static final List<Keycode> TRANSPOSE = transpose();

    public static final List<Keycode> VELOCITY = velocity();

    public static final List<Keycode> CHANNEL = channel();

    public static final List<Keycode> CONTROL = List.of(
            midi("MI_SUS", "MI\nSust").withTooltip("Midi Sustain").build(),
            midi("MI_PORT", "MI\nPort").withTooltip("Midi Portmento").build(),
            midi("MI_SOST", "MI\nSost").withTooltip("Midi Sostenuto").build(),
            midi("MI_SOFT", "MI\nSPedal").withTooltip("Midi Soft Pedal").build(),
            midi("MI_LEG", "MI\nLegat").withTooltip("Midi Legato").build(),
            midi("MI_MOD", "MI\nModul").withTooltip("Midi Modulation").build(),
            midi("MI_MODSD", "MI\nModulDN").withTooltip("Midi decrease modulation speed").build(),
            midi("MI_MODSU", "MI\nModulUP").withTooltip("Midi increase modulation speed").build(),
            midi("MI_BENDD", "MI\nBendDN").withTooltip("Midi bend pitch down").build(),
            midi("MI_BENDU", "MI\nBendUP").withTooltip("Midi bend pitch up").build()
    );

    public static final List<Keycode> SEQUENCER = List.of(
            midi("SQ_ON", "SQ\nOn").withTooltip("Sequencer on").build(),
            midi("SQ_OFF", "SQ\nOff").withTooltip("Sequencer off").build(),
            midi("SQ_TOGG", "SQ\nToggle").withTooltip("Toggle sequencer").build(),
            midi("SQ_TMPD", "SQ\nTempo-").withTooltip("Decrease sequencer tempo").build(),
            midi("SQ_TMPU", "SQ\nTempo+").withTooltip("Increase sequencer tempo").build(),
            midi("SQ_RESD", "SQ\nRes-").withTooltip("Decrease sequencer resolution").build(),
            midi("SQ_RESU", "SQ\nRes+").withTooltip("Increase sequencer resolution").build(),
            midi("SQ_SALL", "SQ\nAll").withTooltip("Select all sequencer steps").build(),
            midi("SQ_SCLR", "SQ\nClear").withTooltip("Clear all sequencer steps").build()
    );

    public static final List<Keycode> ADVANCED = Catalogs.concat(OCTAVE, TRANSPOSE, VELOCITY, CHANNEL, CONTROL, SEQUENCER);

    private MidiKeycodes() {
    }

    private static Keycode.Builder midi(String id, String label) {
        return Keycode.builder(id, label).withCategory(KeycodeCategory.MIDI);
    }

    private static List<Keycode> basic() {
        List<Keycode> keys = new ArrayList<>(List.of(
            midi("MI_C", "MI\nC").withTooltip("Midi send note C").build(),
            midi("MI_Cs", "MI\nC#/Db").withTooltip("Midi send note C#/Db").withAliases("MI_Db").build(),
            midi("MI_D", "MI\nD").withTooltip("Midi send note D").build(),
            midi("MI_Ds", "MI\nD#/Eb").withTooltip("Midi send note D#/Eb").withAliases("MI_Eb").build(),
            midi("MI_E", "MI\nE").withTooltip("Midi send note E").build(),
            midi("MI_F", "MI\nF").withTooltip("Midi send note F").build(),
            midi("MI_Fs", "MI\nF#/Gb").withTooltip("Midi send note F#/Gb").withAliases("MI_Gb").build(),
            midi("MI_G", "MI\nG").withTooltip("Midi send note G").build(),
            midi("MI_Gs", "MI\nG#/Ab").withTooltip("Midi send note G#/Ab").withAliases("MI_Ab").build(),
            midi("MI_A", "MI\nA").withTooltip("Midi send note A").build(),
            midi("MI_As", "MI\nA#/Bb").withTooltip("Midi send note A#/Bb").withAliases("MI_Bb").build(),
            midi("MI_B", "MI\nB").withTooltip("Midi send note B").build()
        ));
        for (int octave = 1; octave <= 5; octave++) {
            for (String note : NOTES) {
                keys.add(midi("MI_" + note + "_" + octave, "MI\n" + note + octave)
                        .withTooltip("Midi send note " + note + octave).build());
            }
        }
        keys.add(midi("MI_ALLOFF", "MI\nNotesOff").withTooltip("Midi send all notes OFF").build());
        return List.copyOf(keys);
    }

    private static List<Keycode> transpose() {
        List<Keycode> keys = new ArrayList<>(15);
        for (int n = -6; n <= 6; n++) {
            String id = n < 0 ? "MI_TRNS_N" + (-n) : "MI_TRNS_" + n;
            String sign = n > 0 ? "+" : "";
            keys.add(midi(id, "MI\nTrans" + sign + n)
                    .withTooltip("Midi set transposition to " + n + " semitones").build());
        }
        keys.add(midi("MI_TRNSD", "MI\nTransDN").withTooltip("Midi decrease transposition").build());
        keys.add(midi("MI_TRNSU", "MI\nTransUP").withTooltip("Midi increase transposition").build());
        return List.copyOf(keys);
    }

    private static List<Keycode> velocity() {
        List<Keycode> keys = new ArrayList<>(12);
        for (int i = 1; i <= 10; i++) {
            keys.add(midi("MI_VEL_" + i, "MI\nVel" + i).withTooltip("Midi set velocity to " + i).build());
        }
        keys.add(midi("MI_VELD", "MI\nVelDN").withTooltip("Midi decrease velocity").build());
        keys.add(midi("MI_VELU", "MI\nVelUP").withTooltip("Midi increase velocity").build());
        return List.copyOf(keys);
    }

    private static List<Keycode> channel() {
        List<Keycode> keys = new ArrayList<>(18);
        for (int i = 1; i <= 16; i++) {
            keys.add(midi("MI_CH" + i, "MI\nCH" + i).withTooltip("Midi set channel to " + i).build());
        }
        keys.add(midi("MI_CHD", "MI\nCHDN").withTooltip("Midi decrease channel").build());
        keys.add(midi("MI_CHU", "MI\nCHUP").withTooltip("Midi increase channel").build());
        return List.copyOf(keys);
    }
}
