package com.example.chatfunctions.vision;

import com.example.chatfunctions.model.ObjectRef;
import com.example.chatfunctions.model.SafeSearchVerdict;

public interface ImageClassifier {
    SafeSearchVerdict classify(ObjectRef image);
}
