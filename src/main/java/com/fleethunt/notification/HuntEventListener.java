package com.fleethunt.notification;

import com.fleethunt.model.HuntNotification;

@FunctionalInterface
public interface HuntEventListener {

  void onEvent(String eventName, HuntNotification notification);
}
