package com.gentoro.clm.nlp;

public enum EntityType {
  EMAIL,
  PHONE,
  MONEY,
  REFERENCE,
  ACCOUNT,
  ORDER,
  TRACKING,
  PERSON
}
