package io.autolv.panel;

/**
 * Waveform or XY graph. See {@link GraphData#from(Object)} for how a value is interpreted.
 */
public final class WaveformGraphControl extends Control<GraphData> {

    private GraphData value = GraphData.dense(NumericArray.empty());

    public WaveformGraphControl(ControlAttributes attributes) {
        super(ControlKind.WAVEFORM_GRAPH, attributes);
    }

    @Override
    public GraphData value() {
        return value;
    }

    @Override
    public void setValue(Object value) {
        try {
            this.value = GraphData.from(value);
        } catch (IllegalArgumentException ex) {
            throw ControlTypeException.rejected(this, value, ex.getMessage(), ex);
        }
    }

    public boolean isSampled() {
        return value instanceof GraphData.Sampled;
    }
}
