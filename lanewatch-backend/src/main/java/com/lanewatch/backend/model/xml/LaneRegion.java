package com.lanewatch.backend.model.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

@Data
public class LaneRegion {
    @JacksonXmlProperty(isAttribute = true)
    private String name;

    @JacksonXmlProperty(isAttribute = true)
    private double x1;

    @JacksonXmlProperty(isAttribute = true)
    private double y1;

    @JacksonXmlProperty(isAttribute = true)
    private double x2;

    @JacksonXmlProperty(isAttribute = true)
    private double y2;
}
