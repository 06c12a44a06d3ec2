package com.positionalert.engine.domain.position;

import com.positionalert.common.position.Position;
import java.util.List;

/** Supplies the positions to check for one run. */
public interface PositionSource {

    /**
     * @throws com.positionalert.engine.domain.exceptions.PositionsParseException when the
     *     source cannot be read or holds no usable positions
     */
    List<Position> load();
}
