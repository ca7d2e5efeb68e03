package clitree.demo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class Worker {
    private final String name;

    private final int id;

    @JsonCreator
    public Worker(@JsonProperty(value = "name", required = true) final String name, @JsonProperty(value = "id", required = true) final int id) {
        this.name = name;
        this.id = id;
    }
}
