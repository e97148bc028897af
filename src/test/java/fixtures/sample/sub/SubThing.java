package fixtures.sample.sub;

public interface SubThing {
}
