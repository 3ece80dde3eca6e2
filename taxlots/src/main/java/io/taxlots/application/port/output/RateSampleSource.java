package io.taxlots.application.port.output;

import io.taxlots.domain.fx.RateSample;

import java.util.List;

/**
 * Output Port: Published daily exchange rates, oldest first.
 */
public interface RateSampleSource {

    List<RateSample> load();
}
