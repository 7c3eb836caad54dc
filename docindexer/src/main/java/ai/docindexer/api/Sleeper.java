package ai.docindexer.api;

@FunctionalInterface
public interface Sleeper {

  void sleep(long millis) throws InterruptedException;

  class Default implements Sleeper {
    @Override
    public void sleep(long millis) throws InterruptedException {
      if (millis > 0) {
        Thread.sleep(millis);
      }
    }
  }
}
