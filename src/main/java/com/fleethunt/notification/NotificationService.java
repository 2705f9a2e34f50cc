package com.fleethunt.notification;

import com.fleethunt.model.HuntNotification;

public interface NotificationService {

  void publish(String eventName, HuntNotification notification);
}
