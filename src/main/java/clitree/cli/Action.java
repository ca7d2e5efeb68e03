package clitree.cli;

@FunctionalInterface
public interface Action {
    void run(ActionContext context) throws Exception;
}
