package fixtures.sample;

public class Edge {
    public Node target;
}
