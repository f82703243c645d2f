package cafe.woden.roomarchiver;

import org.springframework.boot.ExitCodeGenerator;

/** Process exit status of the archiving run: non-zero when any room failed. */
public class RunExitCode implements ExitCodeGenerator {

  private volatile int code;

  void set(int code) {
    this.code = code;
  }

  @Override
  public int getExitCode() {
    return code;
  }
}
