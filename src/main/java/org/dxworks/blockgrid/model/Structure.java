package org.dxworks.blockgrid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Structure {
    public String id;
    public List<Line> lines = new ArrayList<>();

    public Structure() {
    }

    public Structure(String id, List<Line> lines) {
        this.id = id;
        this.lines = new ArrayList<>(lines);
    }

    public static Structure of(List<Line> lines) {
        return new Structure(null, lines);
    }
}
