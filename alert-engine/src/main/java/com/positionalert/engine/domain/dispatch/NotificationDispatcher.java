package com.positionalert.engine.domain.dispatch;

import com.positionalert.common.event.AlertEvent;
import java.util.List;

/** Hands decided alerts to the delivery channels and reports what got through. */
public interface NotificationDispatcher {

    DispatchReport dispatch(List<AlertEvent> events);
}
