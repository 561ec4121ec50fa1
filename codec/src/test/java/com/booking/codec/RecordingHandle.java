package com.booking.codec;

import java.util.ArrayList;
import java.util.List;

/** Handle whose driver writes a readable token per call, see {@link RecordingDriver}. */
public class RecordingHandle extends Handle {
  final List<RecordingDriver> drivers = new ArrayList<>();

  public RecordingHandle() {
    super("rec");
  }

  public RecordingHandle(TypeRegistry typeRegistry) {
    super("rec", typeRegistry);
  }

  @Override
  protected EncDriver newEncDriver(Encoder encoder) {
    RecordingDriver driver = new RecordingDriver(encoder);
    drivers.add(driver);
    return driver;
  }
}
