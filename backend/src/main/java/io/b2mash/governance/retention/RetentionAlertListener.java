package io.b2mash.governance.retention;

@FunctionalInterface
public interface RetentionAlertListener {

  void onAlert(RetentionAlert alert);
}
