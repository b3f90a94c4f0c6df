package io.sieve.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.sieve.menu.api.MenuConfig;
import io.sieve.menu.api.MenuEngine;
import io.sieve.menu.api.MenuSession;
import io.sieve.menu.api.Outcome;
import io.sieve.menu.source.LineEntrySource;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MenuLoopTest {
  private MenuEngine engine = MenuEngine.create(MenuConfig.defaults().withThreads(1));

  @AfterEach
  void tearDown() {
    engine.close();
  }

  /** Plays back scripted steps and records what each session looked like. */
  private static final class ScriptedInteractor implements MenuLoop.Interactor {
    private final Deque<Function<MenuSession, Outcome>> steps = new ArrayDeque<>();
    private final List<String> modesSeen = new ArrayList<>();
    private final List<String> queriesSeen = new ArrayList<>();
    private final List<Integer> selectionsSeen = new ArrayList<>();

    ScriptedInteractor then(Function<MenuSession, Outcome> step) {
      steps.add(step);
      return this;
    }

    ScriptedInteractor then(Outcome outcome) {
      return then(session -> outcome);
    }

    @Override
    public Outcome interact(MenuSession session, Modes modes) {
      modesSeen.add(modes.current().name());
      queriesSeen.add(session.currentQueryText());
      selectionsSeen.add(session.selectedIndex());
      return steps.removeFirst().apply(session);
    }
  }

  private static Modes modes(String... names) {
    List<Modes.Mode> list = new ArrayList<>();
    for (String name : names) {
      list.add(new Modes.Mode(name, new LineEntrySource(List.of(name + "-1", name + "-2"))));
    }
    return new Modes(list);
  }

  @Test
  void modeCyclingResetsQuery() throws IOException {
    ScriptedInteractor interactor =
        new ScriptedInteractor()
            .then(new Outcome.NextMode())
            .then(new Outcome.NextMode())
            .then(new Outcome.PreviousMode())
            .then(new Outcome.Accept(1, false));

    MenuLoop.Result result =
        new MenuLoop(engine, interactor).run(modes("run", "window", "ssh"), "fi", 0);

    assertEquals(List.of("run", "window", "ssh", "window"), interactor.modesSeen);
    assertEquals(List.of("fi", "", "", ""), interactor.queriesSeen);
    assertEquals(new Outcome.Accept(1, false), result.outcome());
    assertEquals("window", result.mode().name());
  }

  @Test
  void quickSwitchChangesModeWhenItExists() throws IOException {
    ScriptedInteractor interactor =
        new ScriptedInteractor()
            .then(new Outcome.QuickSwitch(2, Outcome.NO_ENTRY))
            .then(new Outcome.QuickSwitch(7, 0));

    MenuLoop.Result result =
        new MenuLoop(engine, interactor).run(modes("run", "window", "ssh"), "", 0);

    assertEquals(List.of("run", "ssh"), interactor.modesSeen);
    assertEquals(new Outcome.QuickSwitch(7, 0), result.outcome());
    assertEquals("ssh", result.mode().name());
  }

  @Test
  void quickSwitchWithSingleModeIsReturned() throws IOException {
    ScriptedInteractor interactor =
        new ScriptedInteractor().then(new Outcome.QuickSwitch(0, Outcome.NO_ENTRY));

    MenuLoop.Result result = new MenuLoop(engine, interactor).run(modes("run"), "", 0);

    assertEquals(new Outcome.QuickSwitch(0, Outcome.NO_ENTRY), result.outcome());
  }

  @Test
  void deleteRebuildsSessionOnFollowingEntry() throws IOException {
    Modes modes =
        new Modes(
            List.of(new Modes.Mode("history", new LineEntrySource(List.of("a", "b", "c", "d")))));
    ScriptedInteractor interactor =
        new ScriptedInteractor()
            .then(
                session -> {
                  session.selectEntry(1);
                  return new Outcome.DeleteEntry(session.selectedEntry());
                })
            .then(session -> new Outcome.Accept(session.selectedEntry(), false));

    MenuLoop.Result result = new MenuLoop(engine, interactor).run(modes, "", 0);

    assertEquals(List.of("a", "c", "d"), result.mode().source().lines());
    assertEquals(new Outcome.Accept(1, false), result.outcome());
    assertEquals("c", result.mode().source().completion(1));
  }

  @Test
  void deletingLastEntryKeepsRowAbove() throws IOException {
    Modes modes =
        new Modes(List.of(new Modes.Mode("history", new LineEntrySource(List.of("a", "b", "c")))));
    ScriptedInteractor interactor =
        new ScriptedInteractor()
            .then(
                session -> {
                  session.selectEntry(2);
                  return new Outcome.DeleteEntry(2);
                })
            .then(new Outcome.Cancel());

    new MenuLoop(engine, interactor).run(modes, "", 0);

    assertEquals(List.of(0, 1), interactor.selectionsSeen);
    assertEquals(List.of("a", "b"), modes.current().source().lines());
  }

  @Test
  void deleteKeepsQuery() throws IOException {
    Modes modes =
        new Modes(
            List.of(new Modes.Mode("h", new LineEntrySource(List.of("foo", "bar", "food")))));
    ScriptedInteractor interactor =
        new ScriptedInteractor()
            .then(session -> new Outcome.DeleteEntry(session.selectedEntry()))
            .then(new Outcome.Cancel());

    new MenuLoop(engine, interactor).run(modes, "foo", 0);

    assertEquals(List.of("foo", "foo"), interactor.queriesSeen);
    assertEquals(List.of("bar", "food"), modes.current().source().lines());
  }

  @Test
  void initialSelectedRowIsClamped() throws IOException {
    ScriptedInteractor interactor = new ScriptedInteractor().then(new Outcome.Cancel());

    new MenuLoop(engine, interactor).run(modes("run"), "", 5);

    assertEquals(List.of(1), interactor.selectionsSeen);
  }

  @Test
  void autoSelectedSessionSkipsInteraction() throws IOException {
    engine.close();
    engine = MenuEngine.create(MenuConfig.defaults().withThreads(1).withAutoSelect(true));
    ScriptedInteractor interactor = new ScriptedInteractor();

    MenuLoop.Result result = new MenuLoop(engine, interactor).run(modes("run"), "run-2", 0);

    assertTrue(interactor.modesSeen.isEmpty());
    assertEquals(new Outcome.Accept(1, false), result.outcome());
  }
}
