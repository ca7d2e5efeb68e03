package clitree;

public interface Const {
    String ECHO = "echo";
    String DEMO = "demo";
}
