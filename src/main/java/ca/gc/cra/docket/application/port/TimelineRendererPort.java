package ca.gc.cra.docket.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Output port receiving the final ordered timeline.
 * <p><strong>Why:</strong> Visual layout is a separate concern; the export pipeline only produces the ordered
 * sequence of items and a generation timestamp.</p>
 * <p><strong>Role:</strong> Implemented by {@code NdjsonTimelineWriter}; document renderers plug in here.</p>
 *
 * @since 0.1.0
 */
public interface TimelineRendererPort {
  /**
   * Renders the timeline.
   *
   * @param timeline ordered timeline
   * @return human-readable location of the rendered artifact (e.g., a file path)
   * @throws IOException if the artifact cannot be written
   */
  String render(ExportedTimeline timeline) throws IOException;
}
