package com.jreinhal.insight.controller;

import com.jreinhal.insight.access.AccessModel;
import com.jreinhal.insight.model.User;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/categories"})
@Tag(name="Categories")
public class CategoryController {
    private final AccessModel accessModel;

    public CategoryController(AccessModel accessModel) {
        this.accessModel = accessModel;
    }

    @GetMapping
    public Map<String, Object> visibleCategories() {
        User user = ConversationController.requireUser();
        List<String> categories = new ArrayList<String>(new TreeSet<String>(this.accessModel.resolveVisibleCategories(user)));
        return Map.of("count", categories.size(), "categories", categories,
                "accessVersion", this.accessModel.currentAccessVersion(user));
    }
}
