package com.ragingest.index;

public record AliasBinding(String aliasName, String collectionName) {
}
