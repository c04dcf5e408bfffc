package io.autolv.session;

import io.autolv.panel.ArrayClusterControl;
import io.autolv.panel.ArrayControl;
import io.autolv.panel.ClusterControl;
import io.autolv.panel.Control;
import io.autolv.panel.ControlTypeException;
import io.autolv.panel.GraphData;
import io.autolv.panel.IoRefNum;
import io.autolv.panel.IoRefNumControl;
import io.autolv.panel.PathControl;
import io.autolv.panel.Sequences;
import io.autolv.panel.TimestampControl;
import io.autolv.panel.WaveformGraphControl;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Converts values between the control tree and the transport form used by {@link ControlValueSource}.
 */
public final class TransportValues {

  private final ZoneId zone;

  public TransportValues(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Stores a value read from the source into the control.
   *
   * @throws ControlTypeException when the value does not fit the control
   */
  public void apply(Control<?> control, Object transported) {
    if (control instanceof ArrayClusterControl arrayCluster) {
      arrayCluster.replaceElements(elements(arrayCluster, transported));
    } else {
      control.setValue(normalize(control, transported));
    }
  }

  /** Transport form of the control's current value. */
  public Object toTransport(Control<?> control) {
    if (control instanceof TimestampControl timestamp) {
      return timestamp.value().atZone(zone);
    }
    if (control instanceof PathControl path) {
      return path.value();
    }
    if (control instanceof ArrayControl array) {
      return array.value().toList();
    }
    if (control instanceof WaveformGraphControl graph) {
      return graphData(graph.value());
    }
    if (control instanceof IoRefNumControl refNum) {
      IoRefNum value = refNum.value();
      return List.of(value.label(), value.aux());
    }
    if (control instanceof ClusterControl cluster) {
      return members(cluster);
    }
    if (control instanceof ArrayClusterControl arrayCluster) {
      List<Object> rows = new ArrayList<>(arrayCluster.size());
      arrayCluster.value().forEach(element -> rows.add(members(element)));
      return Collections.unmodifiableList(rows);
    }
    return control.value();
  }

  // zoned timestamps become local ones, also inside positional cluster values
  private Object normalize(Control<?> control, Object transported) {
    if (control instanceof TimestampControl) {
      return toLocal(transported);
    }
    if (control instanceof ClusterControl cluster && Sequences.isSequence(transported)) {
      List<Object> items = Sequences.toList(transported);
      if (items.size() == cluster.size()) {
        List<Object> normalized = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
          normalized.add(normalize(cluster.get(i), items.get(i)));
        }
        return normalized;
      }
    }
    return transported;
  }

  private Object toLocal(Object transported) {
    if (transported instanceof ZonedDateTime zoned) {
      return zoned.withZoneSameInstant(zone).toLocalDateTime();
    }
    if (transported instanceof OffsetDateTime offset) {
      return offset.atZoneSameInstant(zone).toLocalDateTime();
    }
    if (transported instanceof Instant instant) {
      return LocalDateTime.ofInstant(instant, zone);
    }
    return transported;
  }

  private List<ClusterControl> elements(ArrayClusterControl arrayCluster, Object transported) {
    if (!Sequences.isSequence(transported)) {
      throw new ControlTypeException(
          "'" + transported + "' is not a sequence of cluster values for '" + arrayCluster.name() + "'");
    }
    List<ClusterControl> elements = new ArrayList<>();
    for (Object row : Sequences.toList(transported)) {
      ClusterControl element = arrayCluster.newElement();
      element.setValue(normalize(element, row));
      elements.add(element);
    }
    return elements;
  }

  private List<Object> members(ClusterControl cluster) {
    List<Object> values = new ArrayList<>(cluster.size());
    cluster.forEach(member -> values.add(toTransport(member)));
    return Collections.unmodifiableList(values);
  }

  private static Object graphData(GraphData data) {
    if (data instanceof GraphData.Sampled sampled) {
      return List.of(sampled.t0(), sampled.dt(), sampled.y().toList());
    }
    return ((GraphData.Dense) data).values().toList();
  }
}
