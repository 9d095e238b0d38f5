package app.skyscraper.scraper.parse;

import java.util.List;

public record PageForm(String action, String method, List<FormInput> inputs) {

    public record FormInput(String name, String type, String placeholder, boolean required) {
    }
}
