package com.lorastudio.training;

public record BaseModel(String id, String license, double parametersBillions, boolean approved) {
}
