package fr.lapetina.sessionpool.driver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Opens {@link StubSessionDriver}s, scripting each one and keeping track of them.
 */
public class StubDriverFactory implements SessionDriverFactory {

    private final List<StubSessionDriver> opened = new CopyOnWriteArrayList<>();
    private volatile Consumer<StubSessionDriver> script = driver -> { };
    private volatile RuntimeException openFailure;

    public StubDriverFactory script(Consumer<StubSessionDriver> script) {
        this.script = script;
        return this;
    }

    public StubDriverFactory failOpen(RuntimeException failure) {
        this.openFailure = failure;
        return this;
    }

    @Override
    public SessionDriver open() {
        if (openFailure != null) {
            throw openFailure;
        }
        StubSessionDriver driver = new StubSessionDriver();
        script.accept(driver);
        opened.add(driver);
        return driver;
    }

    public List<StubSessionDriver> opened() {
        return List.copyOf(opened);
    }

    public StubSessionDriver last() {
        return opened.get(opened.size() - 1);
    }
}
