package com.lanewatch.backend.model.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;
import java.util.List;

@Data
@JacksonXmlRootElement(localName = "layout")
public class LaneLayout {

    @JacksonXmlProperty(isAttribute = true)
    private String description;

    @JacksonXmlElementWrapper(localName = "lanes")
    @JacksonXmlProperty(localName = "lane")
    private List<LaneRegion> lanes;
}
