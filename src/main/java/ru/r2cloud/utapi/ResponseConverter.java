package ru.r2cloud.utapi;

import com.eclipsesource.json.JsonObject;

interface ResponseConverter<T> {

	T convert(JsonObject obj);

}
